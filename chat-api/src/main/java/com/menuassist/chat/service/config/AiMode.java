package com.menuassist.chat.service.config;

public enum AiMode {
    TEXT_ONLY,
    SPEECH_ENABLED,
    HYBRID
}
