package com.chainindexer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One validator's commit signature on the height of a grant. accountIndex is the validator the grant is about.
 * At most one row per (height, voterIndex).
 */
@Document(collection = "grant_votes")
@CompoundIndex(name = "height_voter", def = "{'height': 1, 'voterIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class GrantVote {

    public static final String SEQUENCE_NAME = "grant_votes";

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    private long proposerIndex;
    private String proposerAddress;
    @Indexed
    private long accountIndex;
    private String accountAddress;
    private long voterIndex;
    @Indexed
    private String voterAddress;
    private long height;
    private long vote;
}
