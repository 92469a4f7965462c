package com.meshnexus.probe;

import com.meshnexus.model.SecurityFinding;

import java.util.List;
import java.util.Set;

public interface AccessControl {

    void block(String address);

    void unblock(String address);

    Set<String> blockedAddresses();

    /**
     * Inspects the host for suspicious activity. Called by the periodic access-control sweep.
     */
    default List<SecurityFinding> audit() {
        return List.of();
    }
}
