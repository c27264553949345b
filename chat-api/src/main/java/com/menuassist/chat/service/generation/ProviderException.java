package com.menuassist.chat.service.generation;

public class ProviderException extends RuntimeException {

    private final ProviderFailure failure;

    public ProviderException(ProviderFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ProviderException(ProviderFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public ProviderFailure getFailure() {
        return failure;
    }
}
