package com.menuassist.chat.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatFeedback(
        @NotBlank @Size(max = 36) String conversationId,
        @Size(max = 36) String messageId,
        @Min(1) @Max(5) Integer rating,
        Boolean helpful,
        @Size(max = 2000) String comment
) {
}
