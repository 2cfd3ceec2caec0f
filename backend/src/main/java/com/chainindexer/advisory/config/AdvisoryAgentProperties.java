package com.chainindexer.advisory.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Advisory agent endpoint. Blank url selects the no-op client.
 */
@ConfigurationProperties(prefix = "chainindexer.advisory")
@NoArgsConstructor
@Getter
@Setter
public class AdvisoryAgentProperties {

    /** Base URL of the agent service, e.g. http://localhost:3000. */
    private String url;

    /** Fixed agent id; when blank the first agent from GET /agents is used. */
    private String agentId;

    /** Per-request timeout in ms. Default 30000 (agents answer slowly). */
    private long timeoutMs = 30_000L;

    /** Agent id resolution retry: base delay, jitter, attempts. */
    private long retryBaseDelayMs = 1_000L;
    private double retryJitterFactor = 0.2;
    private int retryMaxAttempts = 3;
}
