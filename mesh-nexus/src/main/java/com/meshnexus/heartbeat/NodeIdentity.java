package com.meshnexus.heartbeat;

import com.meshnexus.config.MeshProperties;
import com.meshnexus.config.NodeRole;
import com.meshnexus.probe.JvmSystemProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;

/**
 * Stable peer id: the configured {@code mesh.heartbeat.node-id}, or the first 16 hex characters
 * of SHA-256 over {@code hostname-mac}.
 */
@Component
@NodeRole
@Slf4j
public class NodeIdentity {

    private final String configuredId;

    public NodeIdentity(MeshProperties properties) {
        this.configuredId = properties.getHeartbeat().getNodeId();
    }

    public String resolve() {
        if (configuredId != null && !configuredId.isBlank()) {
            return configuredId;
        }
        String nodeId = derive(hostname(), primaryMac());
        log.info("Derived node id {}", nodeId);
        return nodeId;
    }

    public static String derive(String hostname, String mac) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((hostname + "-" + mac).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local hostname: {}", e.getMessage());
            return "localhost";
        }
    }

    static String primaryMac() {
        try {
            for (NetworkInterface iface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (iface.isLoopback()) {
                    continue;
                }
                String mac = JvmSystemProbe.formatMac(iface.getHardwareAddress());
                if (mac != null) {
                    return mac;
                }
            }
        } catch (SocketException e) {
            log.warn("Cannot read network interfaces: {}", e.getMessage());
        }
        return "00:00:00:00:00:00";
    }
}
