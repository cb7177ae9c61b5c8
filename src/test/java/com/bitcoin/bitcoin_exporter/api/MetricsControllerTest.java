package com.bitcoin.bitcoin_exporter.api;

import com.bitcoin.bitcoin_exporter.service.ScrapeService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {MetricsController.class, FallbackController.class})
class MetricsControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ScrapeService scrapeService;

    @Test
    @DisplayName("GET /metrics should return the rendered text")
    void servesMetrics() {
        String body = "# HELP bitcoin_blocks Current block height\n"
                + "# TYPE bitcoin_blocks gauge\n"
                + "bitcoin_blocks{pod=\"bitcoin-stack-0\"} 800000\n";
        when(scrapeService.scrape()).thenReturn(Mono.just(body));

        webTestClient.get().uri("/metrics")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
                .expectBody(String.class).isEqualTo(body);
    }

    @Test
    @DisplayName("GET /metrics should answer 500 with the error message")
    void reportsInternalErrors() {
        when(scrapeService.scrape()).thenReturn(Mono.error(new IllegalStateException("resolver crashed")));

        webTestClient.get().uri("/metrics")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectBody(String.class).isEqualTo("Error: resolver crashed");
    }

    @Test
    @DisplayName("GET /health should answer OK without scraping")
    void health() {
        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
                .expectBody(String.class).isEqualTo("OK");

        verify(scrapeService, never()).scrape();
    }

    @Test
    @DisplayName("Unknown paths should answer 404 with an empty body")
    void unknownPath() {
        webTestClient.get().uri("/nonexistent")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().isEmpty();

        verify(scrapeService, never()).scrape();
    }
}
