package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Governance proposal keyed by its on-chain index.
 * newHeight is the block that created it; settleHeight stays 0 until a settle event arrives and is never
 * changed afterwards.
 */
@Document(collection = "proposals")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Proposal {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private long proposerIndex;
    @Indexed
    private String proposerAddress;
    private byte[] data;
    @Indexed
    private long newHeight;
    @Indexed
    private long settleHeight;
    private long status;

    public boolean isSettled() {
        return settleHeight != 0;
    }
}
