package com.bitcoin.bitcoin_exporter.config;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class LifecycleLogger implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(LifecycleLogger.class);
    private final ExporterConfigProperties exporterConfigProperties;
    private final int serverPort;

    public LifecycleLogger(ExporterConfigProperties exporterConfigProperties,
                           @Value("${server.port:8000}") int serverPort) {
        this.exporterConfigProperties = exporterConfigProperties;
        this.serverPort = serverPort;
    }

    @Override
    public void run(String... args) {
        log.info("--- Exporter Configuration Loaded ---");

        ExporterConfigProperties.RpcProperties rpc = exporterConfigProperties.getRpc();
        log.info("RPC default host: {}", rpc.getHost());
        log.info("RPC port: {}", rpc.getPort());
        log.info("RPC user: {} (password {})", rpc.getUser(),
                rpc.getPassword() == null || rpc.getPassword().isEmpty() ? "not set" : "set");
        log.info("RPC timeout: {}", rpc.getTimeout());

        ExporterConfigProperties.DiscoveryProperties discovery = exporterConfigProperties.getDiscovery();
        log.info("Discovery service: {} in namespace {} ({})",
                discovery.getServiceName(), discovery.getNamespace(), discovery.getClusterDomain());
        if (discovery.getMaxPods() <= 0) {
            log.warn("bitcoin.discovery.max-pods is {}. Every scrape will use the fallback pod.", discovery.getMaxPods());
        } else {
            log.info("Discovery probes up to {} pod ordinals", discovery.getMaxPods());
        }

        log.info("Bitcoin exporter serving at port {}", serverPort);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down...");
    }
}
