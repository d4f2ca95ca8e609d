package com.mocha.supporters.sync.classify;

public class BlocklistLoadException extends RuntimeException {
    public BlocklistLoadException(String message) {
        super(message);
    }

    public BlocklistLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
