package com.menuassist.chat.service.generation.provider;

import com.menuassist.chat.service.generation.GenerationParameters;
import com.menuassist.chat.service.generation.PromptMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Capabilities of an external AI vendor. Failures are signalled as
 * {@link com.menuassist.chat.service.generation.ProviderException}.
 */
public interface AiProvider {

    String name();

    /**
     * Whether the provider has what it needs (credentials, endpoint) to serve requests.
     */
    boolean isConfigured();

    /**
     * Whether successful answers may be reused for later customers through the response cache.
     */
    default boolean answersCacheable() {
        return true;
    }

    Mono<String> generateText(List<PromptMessage> messages, GenerationParameters parameters);

    /**
     * Text fragments in emission order. Cancelling the subscription stops the upstream call.
     */
    Flux<String> streamText(List<PromptMessage> messages, GenerationParameters parameters);

    Mono<byte[]> synthesizeSpeech(String text, String voice);

    Mono<String> transcribeAudio(byte[] audio, String filename);

    /**
     * Voices accepted by {@link #synthesizeSpeech}. Empty when the provider cannot speak.
     */
    default List<VoiceOption> availableVoices() {
        return List.of();
    }
}
