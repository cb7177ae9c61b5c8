package com.bitcoin.bitcoin_exporter.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Answers every unmapped path with an empty 404 instead of Spring's JSON error body.
 */
@RestController
public class FallbackController {

    private static final Logger log = LoggerFactory.getLogger(FallbackController.class);

    @RequestMapping("/**")
    public ResponseEntity<Void> notFound(ServerHttpRequest request) {
        log.debug("No handler for {} {}", request.getMethod(), request.getPath());
        return ResponseEntity.notFound().build();
    }
}
