package com.bitcoin.bitcoin_exporter.network.client;

import com.bitcoin.bitcoin_exporter.config.ExporterConfigProperties;
import com.bitcoin.bitcoin_exporter.core.rpc.RpcResult;
import com.bitcoin.bitcoin_exporter.network.model.RpcRequest;
import com.bitcoin.bitcoin_exporter.network.model.RpcResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Issues single JSON-RPC 1.0 calls against a bitcoind node.
 * One attempt per call, no retries.
 */
@Component
public class BitcoinRpcClient {
    private static final Logger log = LoggerFactory.getLogger(BitcoinRpcClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final ExporterConfigProperties.RpcProperties rpcProperties;

    public BitcoinRpcClient(WebClient.Builder webClientBuilder,
                            ObjectMapper objectMapper,
                            ExporterConfigProperties exporterConfigProperties) {
        this.rpcProperties = exporterConfigProperties.getRpc();
        // Base URL set per request below, the target pod changes on every call
        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(rpcProperties.getMaxResponseBytes()))
                .build();
        this.objectMapper = objectMapper;
    }

    public Mono<RpcResult<JsonNode>> call(String method, String targetHost) {
        return call(method, List.of(), targetHost);
    }

    /**
     * Sends one RPC request to the given host.
     * @param method RPC method name, e.g. {@code getblockchaininfo}.
     * @param params positional parameters; null is sent as an empty list.
     * @param targetHost host to call, or null for the configured default host.
     * @return a Mono that always completes with a success or failure result and never errors.
     */
    public Mono<RpcResult<JsonNode>> call(String method, List<Object> params, String targetHost) {
        String host = (targetHost == null || targetHost.isBlank()) ? rpcProperties.getHost() : targetHost;
        String url = String.format("http://%s:%d", host, rpcProperties.getPort());
        Duration timeout = rpcProperties.getTimeout();
        log.debug("Calling '{}' on {}", method, host);

        return webClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> headers.setBasicAuth(rpcProperties.getUser(), rpcProperties.getPassword()))
                .bodyValue(RpcRequest.of(method, params))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .map(body -> decode(method, host, body))
                .switchIfEmpty(Mono.fromSupplier(() -> RpcResult.<JsonNode>failure("empty response body")))
                .onErrorResume(e -> Mono.just(RpcResult.<JsonNode>failure(describe(e, timeout))))
                .doOnNext(result -> {
                    if (result.isFailure()) {
                        log.warn("RPC '{}' to {} failed: {}", method, host, result.getFailureReason());
                    }
                });
    }

    private RpcResult<JsonNode> decode(String method, String host, String body) {
        RpcResponse response;
        try {
            response = objectMapper.readValue(body, RpcResponse.class);
        } catch (JsonProcessingException e) {
            return RpcResult.failure("undecodable response: " + e.getOriginalMessage());
        }
        if (response == null) {
            return RpcResult.failure("empty response body");
        }
        if (response.hasError()) {
            return RpcResult.failure("rpc error: " + response.getError());
        }
        if (!response.hasResult()) {
            return RpcResult.failure("response has no result");
        }
        log.debug("RPC '{}' to {} succeeded", method, host);
        return RpcResult.success(response.getResult());
    }

    private static String describe(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + " ms";
        }
        if (e instanceof DataBufferLimitException || e.getCause() instanceof DataBufferLimitException) {
            return "response too large: " + (e instanceof DataBufferLimitException ? e : e.getCause()).getMessage();
        }
        if (e instanceof WebClientResponseException responseException) {
            if (responseException.getStatusCode().is2xxSuccessful() && e.getCause() != null) {
                return "unreadable response: " + e.getCause().getMessage();
            }
            return "HTTP status " + responseException.getStatusCode().value();
        }
        if (e instanceof WebClientRequestException) {
            return "network error: " + e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
