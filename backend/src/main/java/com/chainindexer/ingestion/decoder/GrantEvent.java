package com.chainindexer.ingestion.decoder;

import java.math.BigDecimal;

/**
 * A validator was granted (or refused) membership with the given stake.
 */
public record GrantEvent(
        long validator,
        String address,
        BigDecimal amount,
        long proposerIndex,
        String proposerAddress,
        boolean grant,
        String agentUrl
) {
}
