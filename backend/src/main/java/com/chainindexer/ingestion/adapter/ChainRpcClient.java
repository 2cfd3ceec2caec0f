package com.chainindexer.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * CometBFT JSON-RPC client bound to one endpoint. Owns its connection pool; {@link #close()} releases it.
 */
public interface ChainRpcClient extends AutoCloseable {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param method e.g. "block_results"
     * @param params named params (CometBFT accepts an object)
     * @return response body as string (JSON); errors with RpcException on transport or HTTP failure
     */
    Mono<String> call(String method, Map<String, Object> params);

    String endpoint();

    @Override
    void close();
}
