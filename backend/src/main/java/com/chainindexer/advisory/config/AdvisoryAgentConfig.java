package com.chainindexer.advisory.config;

import com.chainindexer.advisory.AdvisoryAgentClient;
import com.chainindexer.advisory.HttpAdvisoryAgentClient;
import com.chainindexer.advisory.NoOpAdvisoryAgentClient;
import com.chainindexer.common.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Exactly one agent client for the whole application, chosen from chainindexer.advisory.url.
 */
@Configuration
@EnableConfigurationProperties(AdvisoryAgentProperties.class)
@Slf4j
public class AdvisoryAgentConfig {

    @Bean
    public AdvisoryAgentClient advisoryAgentClient(AdvisoryAgentProperties properties,
                                                   WebClient.Builder webClientBuilder,
                                                   ObjectMapper objectMapper) {
        String url = properties.getUrl();
        if (url == null || url.isBlank()) {
            log.info("No advisory agent configured; using no-op client");
            return new NoOpAdvisoryAgentClient();
        }
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetryBaseDelayMs(),
                properties.getRetryJitterFactor(),
                properties.getRetryMaxAttempts());
        log.info("Advisory agent at {}", url);
        return new HttpAdvisoryAgentClient(
                webClientBuilder.clone().baseUrl(url.strip()).build(),
                objectMapper,
                Duration.ofMillis(properties.getTimeoutMs()),
                retryPolicy,
                properties.getAgentId());
    }
}
