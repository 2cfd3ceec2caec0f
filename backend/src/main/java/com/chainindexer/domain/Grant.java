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
 * Latest grant decision per validator index; a later grant for the same validator overwrites it.
 */
@Document(collection = "grants")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Grant {

    /** Index of the validator the grant is about. */
    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private String address;
    @Indexed
    private long height;
    private BigDecimal stake;
    private long proposerIndex;
    private String proposerAddress;
    private boolean grant;
}
