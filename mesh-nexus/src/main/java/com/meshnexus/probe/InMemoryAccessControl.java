package com.meshnexus.probe;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the block list in memory. No firewall rules are installed.
 */
@Slf4j
public class InMemoryAccessControl implements AccessControl {
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();

    @Override
    public void block(String address) {
        if (blocked.add(address)) {
            log.warn("Blocked mesh address {}", address);
        }
    }

    @Override
    public void unblock(String address) {
        if (blocked.remove(address)) {
            log.info("Unblocked mesh address {}", address);
        }
    }

    @Override
    public Set<String> blockedAddresses() {
        return Set.copyOf(blocked);
    }
}
