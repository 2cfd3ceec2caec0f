package com.chainindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain RPC endpoints and client limits. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "chainindexer.ingestion.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainRpcProperties {

    /** CometBFT RPC URLs, tried round-robin on reconnect. Default a local node. */
    private List<String> urls = new ArrayList<>(List.of("http://127.0.0.1:26657"));

    /** Per-request timeout in ms. Default 10000. */
    private long requestTimeoutMs = 10_000L;

    /** Max connections in the client's pool. Default 4. */
    private int maxConnections = 4;

    /** Local cap on RPC requests per second. Default 20. */
    private int maxRequestsPerSecond = 20;

    /** How long a call may wait for a limiter permit before failing, ms. Default 5000. */
    private long limiterTimeoutMs = 5_000L;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
