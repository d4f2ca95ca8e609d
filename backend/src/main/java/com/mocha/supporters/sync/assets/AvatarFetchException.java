package com.mocha.supporters.sync.assets;

public class AvatarFetchException extends RuntimeException {
    public AvatarFetchException(String message) {
        super(message);
    }
}
