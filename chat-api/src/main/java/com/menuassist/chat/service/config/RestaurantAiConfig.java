package com.menuassist.chat.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Per-restaurant assistant configuration. Instances are only persisted after passing validation,
 * so generation always runs with the last valid configuration.
 */
public record RestaurantAiConfig(
        @NotNull AiMode mode,
        @Size(max = 64) String provider,
        @NotNull @Valid ModelSettings model,
        @NotNull @Valid PerformanceSettings performance,
        @NotNull @Valid SpeechSettings speech
) {

    public static final String DEFAULT_VOICE = "nova";

    public static RestaurantAiConfig defaults(String provider, String model, int timeoutSeconds) {
        return new RestaurantAiConfig(
                AiMode.TEXT_ONLY,
                provider,
                new ModelSettings(model, 150, 0.7, 10, null, timeoutSeconds),
                new PerformanceSettings(true, true, 1000, 10.0, 60),
                new SpeechSettings(false, false, DEFAULT_VOICE, false, false)
        );
    }

    public RestaurantAiConfig withProvider(String provider) {
        return new RestaurantAiConfig(mode, provider, model, performance, speech);
    }

    public boolean speechEnabled() {
        return mode != AiMode.TEXT_ONLY && (speech.synthesisEnabled() || speech.recognitionEnabled());
    }

    public boolean synthesisAllowed() {
        return mode != AiMode.TEXT_ONLY && speech.synthesisEnabled();
    }

    public boolean recognitionAllowed() {
        return mode != AiMode.TEXT_ONLY && speech.recognitionEnabled();
    }

    public record ModelSettings(
            @NotBlank @Size(max = 64) String model,
            @Min(10) @Max(4000) int maxTokens,
            @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
            @Min(1) @Max(50) int contextMessages,
            @Size(max = 4000) String systemPromptOverride,
            @Min(1) @Max(120) int timeoutSeconds
    ) {
    }

    public record PerformanceSettings(
            boolean streamingEnabled,
            boolean cacheResponses,
            @Min(1) int maxDailyRequests,
            @DecimalMin("0.0") double maxDailyCostUsd,
            @Min(1) int rateLimitPerMinute
    ) {
    }

    public record SpeechSettings(
            boolean synthesisEnabled,
            boolean recognitionEnabled,
            @NotBlank @Size(max = 32) String defaultVoice,
            boolean voiceSelectionEnabled,
            boolean autoPlay
    ) {
    }
}
