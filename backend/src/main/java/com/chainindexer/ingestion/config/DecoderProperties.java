package com.chainindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chainindexer.ingestion.decoder")
@NoArgsConstructor
@Getter
@Setter
public class DecoderProperties {

    /** Event attribute keys and values arrive base64-encoded (CometBFT before 0.37). Default false. */
    private boolean base64Attributes = false;
}
