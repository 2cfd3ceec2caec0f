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
 * One validator's commit signature on a proposal admission or settlement height.
 * At most one row per (height, voterIndex); VoteReconciler checks before inserting.
 */
@Document(collection = "proposal_votes")
@CompoundIndex(name = "height_voter", def = "{'height': 1, 'voterIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ProposalVote {

    public static final String SEQUENCE_NAME = "proposal_votes";

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    @Indexed
    private long proposal;
    private long voterIndex;
    @Indexed
    private String voterAddress;
    private long height;
    private long vote;
}
