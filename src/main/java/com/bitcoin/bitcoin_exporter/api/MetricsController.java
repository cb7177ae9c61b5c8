package com.bitcoin.bitcoin_exporter.api;


import com.bitcoin.bitcoin_exporter.core.render.PrometheusTextRenderer;
import com.bitcoin.bitcoin_exporter.service.ScrapeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class MetricsController {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);
    private static final MediaType METRICS_CONTENT_TYPE = MediaType.parseMediaType(PrometheusTextRenderer.CONTENT_TYPE);

    private final ScrapeService scrapeService;

    public MetricsController(ScrapeService scrapeService) {
        this.scrapeService = scrapeService;
    }

    /**
     * Scrapes every discovered pod and returns the gauges in Prometheus text format.
     * Unreachable pods show up as zeroed, unhealthy samples; only unexpected errors give a 500.
     */
    @GetMapping("/metrics")
    public Mono<ResponseEntity<String>> metrics() {
        return scrapeService.scrape()
                .map(body -> ResponseEntity.ok().contentType(METRICS_CONTENT_TYPE).body(body))
                .onErrorResume(e -> {
                    log.error("Scrape failed: {}", e.getMessage(), e);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .contentType(MediaType.TEXT_PLAIN)
                            .body("Error: " + e.getMessage()));
                });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("OK");
    }
}
