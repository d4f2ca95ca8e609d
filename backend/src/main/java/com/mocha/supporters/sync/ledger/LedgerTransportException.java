package com.mocha.supporters.sync.ledger;

public class LedgerTransportException extends RuntimeException {
    public LedgerTransportException(String message) {
        super(message);
    }

    public LedgerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
