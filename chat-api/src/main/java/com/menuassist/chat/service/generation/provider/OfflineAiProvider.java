package com.menuassist.chat.service.generation.provider;

import com.menuassist.chat.service.generation.GenerationParameters;
import com.menuassist.chat.service.generation.PromptMessage;
import com.menuassist.chat.service.generation.ProviderException;
import com.menuassist.chat.service.generation.ProviderFailure;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword replies used when no real provider is configured, so the assistant stays usable in
 * development and demos.
 */
@Component
public class OfflineAiProvider implements AiProvider {

    public static final String NAME = "offline";

    static final String DEFAULT_REPLY =
            "I'm currently in demo mode. Please try again later or ask your server for assistance!";

    private static final Map<String, String> REPLIES = new LinkedHashMap<>();
    private static final Pattern WORD_SPLIT = Pattern.compile("(?<=\\s)");

    static {
        REPLIES.put("menu", "I'd love to help you with our menu, but I'm currently in demo mode. Please check back later!");
        REPLIES.put("ingredient", "I can help with ingredient questions, but I'm currently in demo mode.");
        REPLIES.put("allergen", "For allergen information, I'm currently in demo mode. Please ask your server for detailed allergen info.");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    /**
     * Demo replies must stop as soon as a real provider is configured.
     */
    @Override
    public boolean answersCacheable() {
        return false;
    }

    @Override
    public Mono<String> generateText(List<PromptMessage> messages, GenerationParameters parameters) {
        return Mono.fromSupplier(() -> reply(lastUserMessage(messages)));
    }

    @Override
    public Flux<String> streamText(List<PromptMessage> messages, GenerationParameters parameters) {
        return generateText(messages, parameters)
                .flatMapMany(text -> Flux.fromArray(WORD_SPLIT.split(text)));
    }

    @Override
    public Mono<byte[]> synthesizeSpeech(String text, String voice) {
        return Mono.error(new ProviderException(ProviderFailure.ERROR, "Speech synthesis is not available in demo mode"));
    }

    @Override
    public Mono<String> transcribeAudio(byte[] audio, String filename) {
        return Mono.error(new ProviderException(ProviderFailure.ERROR, "Speech recognition is not available in demo mode"));
    }

    static String reply(String message) {
        String lowered = message == null ? "" : message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : REPLIES.entrySet()) {
            if (lowered.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_REPLY;
    }

    private static String lastUserMessage(List<PromptMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            PromptMessage message = messages.get(i);
            if (PromptMessage.USER.equals(message.role())) {
                return message.content();
            }
        }
        return "";
    }
}
