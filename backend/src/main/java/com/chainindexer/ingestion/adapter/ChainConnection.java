package com.chainindexer.ingestion.adapter;

import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * Owns the single chain RPC client and its health. Every RPC call site goes through {@link #call}, so the
 * reconnect policy lives here only: a transport failure marks the connection unhealthy and tears the client
 * down; the next call (or {@link #ensureConnected()}) builds a fresh client on the next endpoint and calls
 * {@code health} on it before use.
 *
 * <p>JSON-RPC level errors arrive as a normal response body and do not affect health.
 */
@Slf4j
public class ChainConnection implements AutoCloseable {

    static final String HEALTH_METHOD = "health";

    private final ChainRpcClientFactory clientFactory;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final Duration requestTimeout;

    private ChainRpcClient client;
    private boolean healthy;
    private volatile String activeEndpoint;

    public ChainConnection(ChainRpcClientFactory clientFactory, RpcEndpointRotator rotator,
                           RateLimiter rateLimiter, Duration requestTimeout) {
        this.clientFactory = clientFactory;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.requestTimeout = requestTimeout;
    }

    public synchronized boolean isHealthy() {
        return client != null && healthy;
    }

    /**
     * Endpoint of the live client, null while disconnected. Lock-free so status reads never wait on a call.
     */
    public String currentEndpoint() {
        return activeEndpoint;
    }

    /**
     * Reconnects when there is no healthy client. Throws RpcException when the fresh client fails its health check;
     * the connection then stays unhealthy.
     */
    public synchronized void ensureConnected() {
        if (isHealthy()) {
            return;
        }
        teardown();
        String endpoint = rotator.getNextEndpoint();
        ChainRpcClient fresh = clientFactory.create(endpoint);
        try {
            send(fresh, HEALTH_METHOD, Map.of());
        } catch (RuntimeException e) {
            fresh.close();
            throw new RpcException("Connect to " + endpoint + " failed: " + e.getMessage(), e);
        }
        client = fresh;
        healthy = true;
        activeEndpoint = endpoint;
        log.info("Chain RPC connected to {}", endpoint);
    }

    /**
     * Performs one JSON-RPC call and returns the raw response body.
     */
    public synchronized String call(String method, Map<String, Object> params) {
        ensureConnected();
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method);
        }
        try {
            return send(client, method, params);
        } catch (RuntimeException e) {
            markUnhealthy(method, e);
            throw e instanceof RpcException ? e : new RpcException(method + " failed: " + e.getMessage(), e);
        }
    }

    private String send(ChainRpcClient target, String method, Map<String, Object> params) {
        String body = target.call(method, params).block(requestTimeout);
        if (body == null) {
            throw new RpcException(method + " returned empty body");
        }
        return body;
    }

    private void markUnhealthy(String method, RuntimeException cause) {
        log.warn("Chain RPC {} failed on {}, dropping connection: {}", method, currentEndpoint(), cause.getMessage());
        healthy = false;
        teardown();
    }

    private void teardown() {
        if (client != null) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.debug("Closing chain RPC client for {} failed: {}", client.endpoint(), e.getMessage());
            }
            client = null;
        }
        activeEndpoint = null;
    }

    @Override
    public synchronized void close() {
        healthy = false;
        teardown();
    }
}
