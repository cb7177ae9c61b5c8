package com.bitcoin.bitcoin_exporter.service;

import com.bitcoin.bitcoin_exporter.core.model.BitcoinPod;
import com.bitcoin.bitcoin_exporter.core.model.PodMetrics;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Collects every pod concurrently and joins the results.
 */
@Service
public class MetricsAggregator {

    private final PodMetricsCollector podMetricsCollector;

    public MetricsAggregator(PodMetricsCollector podMetricsCollector){
        this.podMetricsCollector = podMetricsCollector;
    }

    /**
     * @return one record per pod, in completion order rather than pod order.
     */
    public Mono<List<PodMetrics>> aggregate(List<BitcoinPod> pods) {
        if (pods.isEmpty()) {
            return Mono.just(List.of());
        }
        // One in-flight collection per pod; discovery caps the pod count.
        return Flux.fromIterable(pods)
                .flatMap(podMetricsCollector::collect, pods.size())
                .collectList();
    }
}
