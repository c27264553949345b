package com.menuassist.chat.service.generation;

import com.menuassist.chat.service.config.RestaurantAiConfig;

import java.time.Duration;

public record GenerationParameters(
        String provider,
        String model,
        int maxTokens,
        double temperature,
        Duration timeout
) {

    public static GenerationParameters from(RestaurantAiConfig config) {
        RestaurantAiConfig.ModelSettings model = config.model();
        return new GenerationParameters(
                config.provider(),
                model.model(),
                model.maxTokens(),
                model.temperature(),
                Duration.ofSeconds(model.timeoutSeconds())
        );
    }
}
