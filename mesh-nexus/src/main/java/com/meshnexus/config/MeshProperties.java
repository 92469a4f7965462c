package com.meshnexus.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "mesh")
public class MeshProperties {
    private String role = "coordinator"; // "coordinator" or "node"
    private String meshInterface = "bat0";
    private Coordinator coordinator = new Coordinator();
    private Stats stats = new Stats();
    private Heartbeat heartbeat = new Heartbeat();
    private Realtime realtime = new Realtime();

    @Data
    public static class Coordinator {
        private String address = "192.168.100.1";
        private Duration offlineThreshold = Duration.ofMillis(60000);
        private Duration probeTimeout = Duration.ofSeconds(30);
        private int reachabilityTimeoutMs = 5000;
        private Duration discoveryInterval = Duration.ofSeconds(10);
        private Duration accessControlInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Stats {
        private Duration interval = Duration.ofSeconds(5);
        private int historySize = 100;
        private int performanceWindowMinutes = 30;
    }

    @Data
    public static class Heartbeat {
        private String nodeId; // derived from hardware identity when empty
        private List<String> coordinatorCandidates = new ArrayList<>(List.of("192.168.100.1", "10.147.0.1", "192.168.1.1"));
        private int coordinatorPort = 3000;
        private Duration interval = Duration.ofSeconds(30);
        private int maxFailures = 5;
        private Duration discoveryTimeout = Duration.ofSeconds(5);
        private Duration heartbeatTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private String diagnosticsTarget = "8.8.8.8";
    }

    @Data
    public static class Realtime {
        private String path = "/ws";
        private String[] allowedOrigins = {"*"};
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration reapInterval = Duration.ofSeconds(60);
        private int sendTimeLimitMs = 10000;
        private int sendBufferSizeBytes = 512 * 1024;
    }
}
