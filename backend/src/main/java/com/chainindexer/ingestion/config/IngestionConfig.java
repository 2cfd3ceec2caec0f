package com.chainindexer.ingestion.config;

import com.chainindexer.ingestion.adapter.ChainConnection;
import com.chainindexer.ingestion.adapter.ChainRpcClientFactory;
import com.chainindexer.ingestion.adapter.CometRpcService;
import com.chainindexer.ingestion.adapter.RpcEndpointRotator;
import com.chainindexer.ingestion.adapter.WebClientChainRpcClient;
import com.chainindexer.ingestion.decoder.ChainEventDecoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the chain RPC boundary (client factory, endpoint rotator, rate limiter, connection) and the decoder.
 */
@Configuration
@EnableConfigurationProperties({ ChainRpcProperties.class, SyncProperties.class, DecoderProperties.class })
public class IngestionConfig {

    @Bean
    public RpcEndpointRotator chainEndpointRotator(ChainRpcProperties properties) {
        return new RpcEndpointRotator(properties.getUrls());
    }

    @Bean
    public ChainRpcClientFactory chainRpcClientFactory(WebClient.Builder webClientBuilder, ChainRpcProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getRequestTimeoutMs());
        return url -> new WebClientChainRpcClient(url, webClientBuilder, properties.getMaxConnections(), timeout);
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainRpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-rpc", config);
    }

    @Bean(destroyMethod = "close")
    public ChainConnection chainConnection(ChainRpcClientFactory chainRpcClientFactory,
                                           RpcEndpointRotator chainEndpointRotator,
                                           RateLimiter chainRpcRateLimiter,
                                           ChainRpcProperties properties) {
        return new ChainConnection(chainRpcClientFactory, chainEndpointRotator, chainRpcRateLimiter,
                Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public CometRpcService cometRpcService(ChainConnection chainConnection, ObjectMapper objectMapper) {
        return new CometRpcService(chainConnection, objectMapper);
    }

    @Bean
    public ChainEventDecoder chainEventDecoder(DecoderProperties properties) {
        return new ChainEventDecoder(properties.isBase64Attributes());
    }
}
