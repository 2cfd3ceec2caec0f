package com.chainindexer.ingestion.adapter;

/**
 * Thrown when a chain RPC call fails (transport, HTTP or JSON-RPC error, unparseable response).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
