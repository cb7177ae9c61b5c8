package com.bitcoin.bitcoin_exporter.service;

import com.bitcoin.bitcoin_exporter.core.model.BitcoinPod;
import com.bitcoin.bitcoin_exporter.core.render.PrometheusTextRenderer;
import com.bitcoin.bitcoin_exporter.network.discovery.PodDiscoveryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Runs one scrape: discover pods, collect them all, render the exposition text.
 * Holds no state between scrapes.
 */
@Service
public class ScrapeService {

    private static final Logger log = LoggerFactory.getLogger(ScrapeService.class);

    private final PodDiscoveryService podDiscoveryService;
    private final MetricsAggregator metricsAggregator;
    private final PrometheusTextRenderer prometheusTextRenderer;

    public ScrapeService(PodDiscoveryService podDiscoveryService,
                         MetricsAggregator metricsAggregator,
                         PrometheusTextRenderer prometheusTextRenderer){
        this.podDiscoveryService = podDiscoveryService;
        this.metricsAggregator = metricsAggregator;
        this.prometheusTextRenderer = prometheusTextRenderer;
    }

    public Mono<String> scrape() {
        return Mono.fromCallable(podDiscoveryService::discover)
                .subscribeOn(Schedulers.boundedElastic()) // DNS lookups block
                .map(this::withFallback)
                .flatMap(pods -> {
                    log.info("Collecting metrics from {} Bitcoin pods", pods.size());
                    return metricsAggregator.aggregate(pods);
                })
                .map(prometheusTextRenderer::render);
    }

    /**
     * Always scrape at least one pod so the exporter keeps returning the gauges.
     */
    List<BitcoinPod> withFallback(List<BitcoinPod> discovered) {
        if (!discovered.isEmpty()) {
            return discovered;
        }
        BitcoinPod fallback = podDiscoveryService.fallbackPod();
        log.info("Using fallback pod: {}", fallback.getHost());
        return List.of(fallback);
    }
}
