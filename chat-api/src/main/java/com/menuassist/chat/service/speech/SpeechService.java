package com.menuassist.chat.service.speech;

import com.menuassist.chat.service.config.RestaurantAiConfig;
import com.menuassist.chat.service.config.RestaurantAiConfigService;
import com.menuassist.chat.service.generation.provider.AiProvider;
import com.menuassist.chat.service.generation.provider.AiProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Text-to-speech and transcription for restaurants whose mode and speech flags allow them.
 */
@Service
public class SpeechService {

    private static final Logger log = LoggerFactory.getLogger(SpeechService.class);

    private final RestaurantAiConfigService configService;
    private final AiProviderRegistry providerRegistry;

    public SpeechService(RestaurantAiConfigService configService, AiProviderRegistry providerRegistry) {
        this.configService = configService;
        this.providerRegistry = providerRegistry;
    }

    public Mono<byte[]> synthesize(String restaurantId, String text, String requestedVoice) {
        return loadConfig(restaurantId).flatMap(config -> {
            if (!config.synthesisAllowed()) {
                return Mono.error(new SpeechDisabledException("Speech synthesis is not enabled for this restaurant"));
            }
            String voice = selectVoice(config, requestedVoice);
            AiProvider provider = providerRegistry.resolve(config.provider());
            return provider.synthesizeSpeech(text, voice)
                    .timeout(timeout(config))
                    .onErrorMap(ex -> unavailable("Speech synthesis", restaurantId, ex));
        });
    }

    public Mono<String> transcribe(String restaurantId, byte[] audio, String filename) {
        return loadConfig(restaurantId).flatMap(config -> {
            if (!config.recognitionAllowed()) {
                return Mono.error(new SpeechDisabledException("Speech recognition is not enabled for this restaurant"));
            }
            AiProvider provider = providerRegistry.resolve(config.provider());
            return provider.transcribeAudio(audio, filename == null || filename.isBlank() ? "audio.webm" : filename)
                    .timeout(timeout(config))
                    .onErrorMap(ex -> unavailable("Speech recognition", restaurantId, ex));
        });
    }

    /**
     * Voices the restaurant's provider offers, with the configured default.
     */
    public Mono<VoiceCatalog> voices(String restaurantId) {
        return loadConfig(restaurantId).map(config -> new VoiceCatalog(
                providerRegistry.resolve(config.provider()).availableVoices(),
                config.speech().defaultVoice(),
                config.speech().voiceSelectionEnabled()));
    }

    String selectVoice(RestaurantAiConfig config, String requestedVoice) {
        if (config.speech().voiceSelectionEnabled() && requestedVoice != null && !requestedVoice.isBlank()) {
            return requestedVoice.trim();
        }
        return config.speech().defaultVoice();
    }

    private Mono<RestaurantAiConfig> loadConfig(String restaurantId) {
        return Mono.fromCallable(() -> configService.getConfig(restaurantId))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Duration timeout(RestaurantAiConfig config) {
        return Duration.ofSeconds(config.model().timeoutSeconds());
    }

    private SpeechUnavailableException unavailable(String operation, String restaurantId, Throwable cause) {
        log.warn("{} failed for restaurant {}: {}", operation, restaurantId, cause.getMessage());
        return new SpeechUnavailableException(operation + " is temporarily unavailable", cause);
    }
}
