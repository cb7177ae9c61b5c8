package com.bitcoin.bitcoin_exporter.service;

import com.bitcoin.bitcoin_exporter.core.model.BitcoinPod;
import com.bitcoin.bitcoin_exporter.core.model.PodMetrics;
import com.bitcoin.bitcoin_exporter.core.rpc.RpcResult;
import com.bitcoin.bitcoin_exporter.network.client.BitcoinRpcClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Reads blockchain, peer and network info from one pod. Each call fails on its own:
 * a failed call zeroes only the fields it feeds, and only getblockchaininfo decides health.
 */
@Service
public class PodMetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(PodMetricsCollector.class);

    static final String GET_BLOCKCHAIN_INFO = "getblockchaininfo";
    static final String GET_PEER_INFO = "getpeerinfo";
    static final String GET_NETWORK_INFO = "getnetworkinfo";

    private final BitcoinRpcClient bitcoinRpcClient;

    public PodMetricsCollector(BitcoinRpcClient bitcoinRpcClient){
        this.bitcoinRpcClient = bitcoinRpcClient;
    }

    /**
     * @return a Mono that always emits one record for the pod, all zero and unhealthy in the worst case.
     */
    public Mono<PodMetrics> collect(BitcoinPod pod) {
        Mono<RpcResult<JsonNode>> blockchainInfo = bitcoinRpcClient.call(GET_BLOCKCHAIN_INFO, pod.getHost());
        Mono<RpcResult<JsonNode>> peerInfo = bitcoinRpcClient.call(GET_PEER_INFO, pod.getHost());
        Mono<RpcResult<JsonNode>> networkInfo = bitcoinRpcClient.call(GET_NETWORK_INFO, pod.getHost());

        return Mono.zip(blockchainInfo, peerInfo, networkInfo)
                .map(results -> toMetrics(pod, results.getT1(), results.getT2(), results.getT3()))
                .onErrorResume(e -> {
                    log.error("Unexpected error collecting metrics from {}: {}", pod.getHost(), e.getMessage(), e);
                    return Mono.just(PodMetrics.unhealthy(pod));
                })
                .defaultIfEmpty(PodMetrics.unhealthy(pod));
    }

    static PodMetrics toMetrics(BitcoinPod pod,
                                RpcResult<JsonNode> blockchainInfo,
                                RpcResult<JsonNode> peerInfo,
                                RpcResult<JsonNode> networkInfo) {
        PodMetrics.PodMetricsBuilder builder = PodMetrics.builder()
                .pod(pod.getName())
                .host(pod.getHost())
                .healthy(blockchainInfo.isSuccess());

        if (blockchainInfo.isSuccess()) {
            JsonNode data = blockchainInfo.getValue();
            builder.blocks(data.path("blocks").asLong(0))
                    .difficulty(data.path("difficulty").asDouble(0))
                    .verificationProgress(data.path("verificationprogress").asDouble(0));
        }
        builder.peers(peerInfo.map(peers -> peers.isArray() ? peers.size() : 0).orElse(0));
        builder.connections(networkInfo.map(data -> data.path("connections").asInt(0)).orElse(0));

        PodMetrics metrics = builder.build();
        log.debug("Collected metrics for {}: {}", pod.getName(), metrics);
        return metrics;
    }
}
