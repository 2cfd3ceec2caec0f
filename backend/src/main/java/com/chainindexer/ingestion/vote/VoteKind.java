package com.chainindexer.ingestion.vote;

/**
 * What a height's commit signatures are counted as, in match priority order.
 */
public enum VoteKind {
    PROPOSAL_ADMISSION,
    PROPOSAL_SETTLEMENT,
    GRANT,
    NONE
}
