package com.menuassist.chat.service.speech;

public class SpeechDisabledException extends RuntimeException {

    public SpeechDisabledException(String message) {
        super(message);
    }
}
