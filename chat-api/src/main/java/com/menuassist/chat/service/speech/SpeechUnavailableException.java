package com.menuassist.chat.service.speech;

public class SpeechUnavailableException extends RuntimeException {

    public SpeechUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
