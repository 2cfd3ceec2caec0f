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
 * A validator's message on a proposal. Append-only; (height, proposal, speaker, data) identifies a message
 * when a height is replayed.
 */
@Document(collection = "discussions")
@CompoundIndex(name = "height_proposal_speaker", def = "{'height': 1, 'proposal': 1, 'speakerIndex': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Discussion {

    public static final String SEQUENCE_NAME = "discussions";

    @Id
    @EqualsAndHashCode.Include
    private Long id;
    @Indexed
    private long proposal;
    private long speakerIndex;
    private String speakerAddress;
    private byte[] data;
    private long height;
}
