package com.chainindexer.ingestion.adapter;

import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CometBFT JSON-RPC client using WebClient over a dedicated reactor-netty connection pool, so that tearing down
 * the client really drops its sockets.
 */
public class WebClientChainRpcClient implements ChainRpcClient {

    private final String endpointUrl;
    private final ConnectionProvider connectionProvider;
    private final WebClient webClient;
    private final AtomicLong requestId = new AtomicLong();

    public WebClientChainRpcClient(String endpointUrl, WebClient.Builder builder, int maxConnections, Duration responseTimeout) {
        this.endpointUrl = endpointUrl;
        this.connectionProvider = ConnectionProvider.builder("chain-rpc")
                .maxConnections(Math.max(1, maxConnections))
                .build();
        HttpClient httpClient = HttpClient.create(connectionProvider).responseTimeout(responseTimeout);
        this.webClient = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public Mono<String> call(String method, Map<String, Object> params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestId.incrementAndGet(),
                "method", method,
                "params", params != null ? params : Map.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(method + " HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(method + " request failed: " + e.getMessage(), e));
    }

    @Override
    public String endpoint() {
        return endpointUrl;
    }

    @Override
    public void close() {
        connectionProvider.dispose();
    }
}
