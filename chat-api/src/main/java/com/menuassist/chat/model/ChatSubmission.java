package com.menuassist.chat.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record ChatSubmission(
        @NotBlank @Size(max = 2000) String message,
        @NotBlank @Size(max = 255) String sessionId,
        Map<String, Object> context
) {
}
