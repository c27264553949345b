package com.menuassist.chat.service.generation.provider.openai;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuassist.chat.service.generation.GenerationParameters;
import com.menuassist.chat.service.generation.PromptMessage;
import com.menuassist.chat.service.generation.ProviderException;
import com.menuassist.chat.service.generation.ProviderFailure;
import com.menuassist.chat.service.generation.provider.AiProvider;
import com.menuassist.chat.service.generation.provider.VoiceOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class OpenAiProvider implements AiProvider {

    public static final String NAME = "openai";

    private static final Logger log = LoggerFactory.getLogger(OpenAiProvider.class);

    private static final List<VoiceOption> VOICES = List.of(
            new VoiceOption("alloy", "Alloy", "Female voice, natural and versatile", "female", "general_purpose"),
            new VoiceOption("echo", "Echo", "Male voice, clear and professional", "male", "professional_announcements"),
            new VoiceOption("fable", "Fable", "Male voice, warm and storytelling", "male", "friendly_conversations"),
            new VoiceOption("onyx", "Onyx", "Male voice, deep and authoritative", "male", "formal_interactions"),
            new VoiceOption("nova", "Nova", "Female voice, young and energetic", "female", "bakery_assistant"),
            new VoiceOption("shimmer", "Shimmer", "Female voice, soft and gentle", "female", "calm_interactions")
    );

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String speechModel;
    private final String transcriptionModel;

    public OpenAiProvider(OpenAiChatClient chatClient,
                          ObjectMapper objectMapper,
                          @Value("${chat.llm.api-key:}") String apiKey,
                          @Value("${chat.llm.speech-model:tts-1}") String speechModel,
                          @Value("${chat.llm.transcription-model:whisper-1}") String transcriptionModel) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.speechModel = speechModel;
        this.transcriptionModel = transcriptionModel;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<VoiceOption> availableVoices() {
        return VOICES;
    }

    @Override
    public Mono<String> generateText(List<PromptMessage> messages, GenerationParameters parameters) {
        return chatClient.complete(request(messages, parameters))
                .switchIfEmpty(Mono.error(() -> malformed("Chat completion returned no body")))
                .map(response -> {
                    OpenAiChatClient.Choice choice = response.firstChoice();
                    if (choice == null || choice.message() == null || choice.message().content() == null
                            || choice.message().content().isBlank()) {
                        throw malformed("Chat completion returned no content");
                    }
                    return choice.message().content().trim();
                });
    }

    @Override
    public Flux<String> streamText(List<PromptMessage> messages, GenerationParameters parameters) {
        return chatClient.stream(request(messages, parameters))
                .takeWhile(event -> !event.done())
                .concatMap(event -> {
                    StreamChoice choice = parseChunk(event.data()).firstChoice();
                    if (choice == null || choice.delta() == null || choice.delta().content() == null
                            || choice.delta().content().isEmpty()) {
                        return Flux.empty();
                    }
                    return Flux.just(choice.delta().content());
                });
    }

    @Override
    public Mono<byte[]> synthesizeSpeech(String text, String voice) {
        return chatClient.speech(new OpenAiChatClient.SpeechPayload(speechModel, text.trim(), voice, "mp3"))
                .filter(audio -> audio.length > 0)
                .switchIfEmpty(Mono.error(() -> malformed("Speech synthesis returned no audio")));
    }

    @Override
    public Mono<String> transcribeAudio(byte[] audio, String filename) {
        return chatClient.transcribe(audio, filename, transcriptionModel)
                .map(response -> response.text() == null ? "" : response.text().trim());
    }

    private OpenAiChatClient.Request request(List<PromptMessage> messages, GenerationParameters parameters) {
        List<OpenAiChatClient.Message> payload = messages.stream()
                .map(message -> new OpenAiChatClient.Message(message.role(), message.content()))
                .toList();
        return new OpenAiChatClient.Request(parameters.model(), payload, parameters.temperature(), parameters.maxTokens());
    }

    private StreamResponse parseChunk(String data) {
        try {
            return objectMapper.readValue(data, StreamResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse streaming chunk: {}", e.getOriginalMessage());
            throw new ProviderException(ProviderFailure.MALFORMED_RESPONSE, "Unparseable streaming chunk", e);
        }
    }

    private static ProviderException malformed(String message) {
        return new ProviderException(ProviderFailure.MALFORMED_RESPONSE, message);
    }

    private record StreamResponse(List<StreamChoice> choices) {

        private StreamChoice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    private record StreamChoice(StreamDelta delta, @JsonProperty("finish_reason") String finishReason) {
    }

    private record StreamDelta(@JsonProperty("content") String content) {
    }
}
