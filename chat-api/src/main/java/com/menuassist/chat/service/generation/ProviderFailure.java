package com.menuassist.chat.service.generation;

import java.util.concurrent.TimeoutException;

public enum ProviderFailure {
    TIMEOUT,
    ERROR,
    MALFORMED_RESPONSE;

    public static ProviderFailure classify(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProviderException providerException) {
                return providerException.getFailure();
            }
            if (current instanceof TimeoutException) {
                return TIMEOUT;
            }
            current = current.getCause();
        }
        return ERROR;
    }
}
