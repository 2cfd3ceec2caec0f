package com.chainindexer.ingestion.adapter;

/**
 * Builds a fresh client for an endpoint. Used by ChainConnection on every (re)connect.
 */
@FunctionalInterface
public interface ChainRpcClientFactory {

    ChainRpcClient create(String endpointUrl);
}
