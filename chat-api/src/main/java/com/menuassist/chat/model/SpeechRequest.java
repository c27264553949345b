package com.menuassist.chat.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SpeechRequest(
        @NotBlank @Size(max = 4096) String text,
        String voice
) {
}
