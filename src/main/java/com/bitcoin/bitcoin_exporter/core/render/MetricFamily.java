package com.bitcoin.bitcoin_exporter.core.render;

import com.bitcoin.bitcoin_exporter.core.model.PodMetrics;
import lombok.Getter;

import java.util.function.Function;

/**
 * The gauges exported for every pod, in output order.
 */
@Getter
public enum MetricFamily {
    BLOCKS("bitcoin_blocks", "Current block height", m -> m.getBlocks()),
    PEERS("bitcoin_peers", "Number of connected peers", m -> m.getPeers()),
    CONNECTIONS("bitcoin_connections", "Number of network connections", m -> m.getConnections()),
    DIFFICULTY("bitcoin_difficulty", "Current network difficulty", m -> m.getDifficulty()),
    VERIFICATION_PROGRESS("bitcoin_verification_progress", "Blockchain verification progress (0-1)",
            m -> m.getVerificationProgress()),
    POD_HEALTHY("bitcoin_pod_healthy", "Bitcoin pod health status", m -> m.isHealthy() ? 1 : 0);

    public static final String TYPE = "gauge";

    private final String metricName;
    private final String help;
    private final Function<PodMetrics, Number> extractor;

    MetricFamily(String metricName, String help, Function<PodMetrics, Number> extractor) {
        this.metricName = metricName;
        this.help = help;
        this.extractor = extractor;
    }

    public Number valueOf(PodMetrics metrics) {
        return extractor.apply(metrics);
    }
}
