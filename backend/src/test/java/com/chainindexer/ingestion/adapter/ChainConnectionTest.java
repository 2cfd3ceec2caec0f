package com.chainindexer.ingestion.adapter;

import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainConnectionTest {

    /** Scripted client; per-endpoint failure switches let tests take a node down and bring it back. */
    private static final class FakeClient implements ChainRpcClient {
        private final String endpoint;
        private final Map<String, Boolean> down;
        private final List<String> calls = new ArrayList<>();
        private boolean closed;

        FakeClient(String endpoint, Map<String, Boolean> down) {
            this.endpoint = endpoint;
            this.down = down;
        }

        @Override
        public Mono<String> call(String method, Map<String, Object> params) {
            calls.add(method);
            if (down.getOrDefault(endpoint, false)) {
                return Mono.error(new RpcException(method + " request failed: connection refused"));
            }
            return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");
        }

        @Override
        public String endpoint() {
            return endpoint;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private final Map<String, Boolean> down = new HashMap<>();
    private final List<FakeClient> created = new ArrayList<>();
    private ChainConnection connection;

    @BeforeEach
    void setUp() {
        ChainRpcClientFactory factory = url -> {
            FakeClient client = new FakeClient(url, down);
            created.add(client);
            return client;
        };
        connection = new ChainConnection(factory,
                new RpcEndpointRotator(List.of("http://a", "http://b")),
                RateLimiter.ofDefaults("test"),
                Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("first call connects, checks health, then issues the request")
    void connectsLazily() {
        assertThat(connection.isHealthy()).isFalse();

        connection.call("status", Map.of());

        assertThat(connection.isHealthy()).isTrue();
        assertThat(connection.currentEndpoint()).isEqualTo("http://a");
        assertThat(created).hasSize(1);
        assertThat(created.get(0).calls).containsExactly("health", "status");
    }

    @Test
    @DisplayName("transport failure tears down the client; next call fails over to the next endpoint")
    void failoverAfterTransportFailure() {
        connection.call("status", Map.of());
        down.put("http://a", true);

        assertThatThrownBy(() -> connection.call("block_results", Map.of("height", "5")))
                .isInstanceOf(RpcException.class);
        assertThat(connection.isHealthy()).isFalse();
        assertThat(created.get(0).closed).isTrue();

        connection.call("block_results", Map.of("height", "5"));

        assertThat(connection.currentEndpoint()).isEqualTo("http://b");
        assertThat(created).hasSize(2);
    }

    @Test
    @DisplayName("a client failing its health check is closed and never used")
    void failedHealthCheckClosesClient() {
        down.put("http://a", true);

        assertThatThrownBy(() -> connection.ensureConnected())
                .isInstanceOf(RpcException.class)
                .hasMessageContaining("http://a");

        assertThat(created.get(0).closed).isTrue();
        assertThat(created.get(0).calls).containsExactly("health");
        assertThat(connection.isHealthy()).isFalse();
        assertThat(connection.currentEndpoint()).isNull();
    }

    @Test
    @DisplayName("close disposes the live client")
    void closeDisposes() {
        connection.ensureConnected();

        connection.close();

        assertThat(created.get(0).closed).isTrue();
        assertThat(connection.isHealthy()).isFalse();
    }
}
