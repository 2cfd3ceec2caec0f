package com.chainindexer.ingestion.account;

import lombok.Getter;

/**
 * A commit signer's address is not known to the chain's account state. The height being reconciled must not be
 * marked indexed; it is retried on the next tick.
 */
@Getter
public class UnknownSignerException extends RuntimeException {

    private final String address;

    public UnknownSignerException(String address, String message) {
        super("Unknown signer " + address + ": " + message);
        this.address = address;
    }
}
