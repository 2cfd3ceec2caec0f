package com.chainindexer.ingestion.adapter.model;

/**
 * One entry of a commit's signature list. validatorAddress is upper-case hex and empty for absent validators.
 */
public record CommitSignature(String validatorAddress, int voteCode) {

    public boolean hasSigner() {
        return validatorAddress != null && !validatorAddress.isBlank();
    }
}
