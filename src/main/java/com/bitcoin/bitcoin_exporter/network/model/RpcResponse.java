package com.bitcoin.bitcoin_exporter.network.model;


import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 1.0 response envelope as returned by bitcoind.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RpcResponse {
    private JsonNode result;
    private JsonNode error;
    private String id;

    public boolean hasResult() {
        return result != null && !result.isNull();
    }

    public boolean hasError() {
        return error != null && !error.isNull();
    }
}
