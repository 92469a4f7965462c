package com.meshnexus.realtime;

import java.io.IOException;

/**
 * Transport-side handle of one connected observer.
 */
public interface ObserverChannel {

    String id();

    void send(String text) throws IOException;

    void close(String reason);

    boolean isOpen();
}
