package com.mocha.supporters.sync.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class SyncAlreadyRunningException extends RuntimeException {
    public SyncAlreadyRunningException(String message) {
        super(message);
    }
}
