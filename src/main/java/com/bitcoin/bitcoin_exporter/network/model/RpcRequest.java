package com.bitcoin.bitcoin_exporter.network.model;


import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RpcRequest {
    public static final String JSONRPC_VERSION = "1.0";
    public static final String REQUEST_ID = "exporter";

    private String jsonrpc;
    private String id;
    private String method;
    private List<Object> params;

    public static RpcRequest of(String method, List<Object> params) {
        return new RpcRequest(JSONRPC_VERSION, REQUEST_ID, method, params == null ? List.of() : params);
    }
}
