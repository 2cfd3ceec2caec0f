package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * Validator keyed by its on-chain index. Upserted on every grant event; never deleted.
 */
@Document(collection = "validators")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Validator {

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    @Indexed
    private String address;
    /** Endpoint of the validator's own advisory agent, as announced in the grant. */
    private String agentUrl;
    private BigDecimal stake;
}
