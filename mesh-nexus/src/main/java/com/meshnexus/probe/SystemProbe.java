package com.meshnexus.probe;

import com.meshnexus.model.SystemMetrics;

import java.util.Map;

public interface SystemProbe {

    SystemMetrics sample();

    /**
     * Interface name to descriptor (mtu, mac, addresses, up, loopback).
     */
    Map<String, Object> networkInterfaces();
}
