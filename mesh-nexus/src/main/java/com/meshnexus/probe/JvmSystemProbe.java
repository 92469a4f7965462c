package com.meshnexus.probe;

import com.meshnexus.exception.ProbeFailureException;
import com.meshnexus.model.SystemMetrics;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class JvmSystemProbe implements SystemProbe {

    @Override
    public SystemMetrics sample() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        SystemMetrics metrics = new SystemMetrics();
        metrics.setCpuCores(os.getAvailableProcessors());
        metrics.setLoadAverage(Math.max(os.getSystemLoadAverage(), 0));
        metrics.setUptimeSeconds(ManagementFactory.getRuntimeMXBean().getUptime() / 1000);

        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            com.sun.management.OperatingSystemMXBean hostOs = (com.sun.management.OperatingSystemMXBean) os;
            double cpuLoad = hostOs.getCpuLoad();
            metrics.setCpuUsage(cpuLoad < 0 ? 0 : cpuLoad * 100);
            long total = hostOs.getTotalMemorySize();
            long free = hostOs.getFreeMemorySize();
            metrics.setMemoryTotal(total);
            metrics.setMemoryFree(free);
            metrics.setMemoryUsed(total - free);
            metrics.setMemoryUsage(total > 0 ? (double) (total - free) / total * 100 : 0);
        }
        return metrics;
    }

    @Override
    public Map<String, Object> networkInterfaces() {
        Map<String, Object> interfaces = new LinkedHashMap<>();
        try {
            for (NetworkInterface iface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                Map<String, Object> descriptor = new LinkedHashMap<>();
                descriptor.put("name", iface.getName());
                descriptor.put("mtu", iface.getMTU());
                descriptor.put("mac", formatMac(iface.getHardwareAddress()));
                descriptor.put("up", iface.isUp());
                descriptor.put("loopback", iface.isLoopback());
                List<String> addresses = new ArrayList<>();
                for (InetAddress address : Collections.list(iface.getInetAddresses())) {
                    addresses.add(address.getHostAddress());
                }
                descriptor.put("addresses", addresses);
                interfaces.put(iface.getName(), descriptor);
            }
        } catch (SocketException e) {
            throw new ProbeFailureException("Failed to list network interfaces", e);
        }
        return interfaces;
    }

    public static String formatMac(byte[] hardwareAddress) {
        if (hardwareAddress == null || hardwareAddress.length == 0) {
            return null;
        }
        StringBuilder mac = new StringBuilder();
        for (int i = 0; i < hardwareAddress.length; i++) {
            if (i > 0) {
                mac.append(':');
            }
            mac.append(String.format("%02x", hardwareAddress[i]));
        }
        return mac.toString();
    }
}
