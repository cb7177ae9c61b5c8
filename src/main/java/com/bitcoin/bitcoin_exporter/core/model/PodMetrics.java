package com.bitcoin.bitcoin_exporter.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Metrics read from one pod during a single scrape. Numeric fields stay at zero
 * when the RPC call that feeds them failed.
 */
@Value
@Builder
public class PodMetrics {
    String pod;
    String host;
    long blocks;
    int peers;
    int connections;
    double difficulty;
    double verificationProgress;
    // true iff getblockchaininfo succeeded
    boolean healthy;

    public static PodMetrics unhealthy(BitcoinPod pod) {
        return PodMetrics.builder()
                .pod(pod.getName())
                .host(pod.getHost())
                .healthy(false)
                .build();
    }
}
