package com.menuassist.chat.service.generation.provider;

import com.fasterxml.jackson.annotation.JsonProperty;

public record VoiceOption(
        String id,
        String name,
        String description,
        String gender,
        @JsonProperty("recommended_for") String recommendedFor
) {
}
