package com.chainindexer.query.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Paging limits for the read API.
 */
@ConfigurationProperties(prefix = "chainindexer.api")
@NoArgsConstructor
@Getter
@Setter
public class QueryProperties {

    /** Page size when the request has none. Default 20. */
    private int defaultPageSize = 20;

    /** Larger requested sizes are clamped to this. Default 100. */
    private int maxPageSize = 100;
}
