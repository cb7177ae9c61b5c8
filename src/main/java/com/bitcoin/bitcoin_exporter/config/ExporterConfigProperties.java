package com.bitcoin.bitcoin_exporter.config;


import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "bitcoin")
public class ExporterConfigProperties {

    private RpcProperties rpc = new RpcProperties();
    private DiscoveryProperties discovery = new DiscoveryProperties();

    @Data
    public static class RpcProperties {
        // Default target when a call names no pod
        private String host = "bitcoin-stack.bitcoin.svc.cluster.local";
        private int port = 18332;
        private String user = "bitcoin";
        private String password = "bitcoin";
        private Duration timeout = Duration.ofSeconds(10);
        // getpeerinfo grows with the peer count and easily passes WebFlux's 256 KB default
        private int maxResponseBytes = 16 * 1024 * 1024;
    }

    @Data
    public static class DiscoveryProperties {
        private String serviceName = "bitcoin-stack";
        private String namespace = "bitcoin";
        private String clusterDomain = "svc.cluster.local";
        private int maxPods = 10; // Upper bound on ordinals probed per scrape
    }

}
