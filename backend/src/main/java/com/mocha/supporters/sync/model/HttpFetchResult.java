package com.mocha.supporters.sync.model;

import java.nio.charset.StandardCharsets;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    byte[] bodyBytes,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTransportFailure() {
        return errorCode != null;
    }

    public String bodyAsString() {
        return bodyBytes == null ? null : new String(bodyBytes, StandardCharsets.UTF_8);
    }
}
