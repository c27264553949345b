package com.menuassist.chat.service.speech;

import com.menuassist.chat.service.generation.provider.VoiceOption;

import java.util.List;

public record VoiceCatalog(List<VoiceOption> voices, String defaultVoice, boolean voiceSelectionEnabled) {

    public VoiceCatalog {
        voices = voices == null ? List.of() : List.copyOf(voices);
    }
}
