package com.menuassist.chat.service.generation.provider.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin WebClient binding of the OpenAI-compatible chat, speech and transcription endpoints.
 * Timeouts are left to the caller; every HTTP or transport failure surfaces as
 * {@link OpenAiChatException}.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final WebClient webClient;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    public Mono<ChatCompletionResponse> complete(Request request) {
        return webClient.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload(request, false))
                .retrieve()
                .bodyToMono(ChatCompletionResponse.class)
                .onErrorMap(WebClientResponseException.class, ex -> logAndWrap("chat completion", ex))
                .onErrorMap(ex -> !(ex instanceof OpenAiChatException),
                        ex -> new OpenAiChatException("Failed to invoke chat completion", ex));
    }

    public Flux<StreamEvent> stream(Request request) {
        return webClient.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload(request, true))
                .retrieve()
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<String>>() {
                })
                .map(event -> event.data() == null ? "" : event.data().trim())
                .filter(data -> !data.isEmpty())
                .map(data -> "[DONE]".equals(data) ? StreamEvent.DONE : new StreamEvent(data, false))
                .onErrorMap(WebClientResponseException.class, ex -> logAndWrap("chat completion stream", ex))
                .onErrorMap(ex -> !(ex instanceof OpenAiChatException),
                        ex -> new OpenAiChatException("Failed to stream chat completion", ex));
    }

    public Mono<byte[]> speech(SpeechPayload payload) {
        return webClient.post()
                .uri("/v1/audio/speech")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(byte[].class)
                .onErrorMap(WebClientResponseException.class, ex -> logAndWrap("speech synthesis", ex))
                .onErrorMap(ex -> !(ex instanceof OpenAiChatException),
                        ex -> new OpenAiChatException("Failed to synthesize speech", ex));
    }

    public Mono<TranscriptionResponse> transcribe(byte[] audio, String filename, String model) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new NamedByteArrayResource(audio, filename));
        body.part("model", model);
        body.part("language", "en");
        return webClient.post()
                .uri("/v1/audio/transcriptions")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(TranscriptionResponse.class)
                .onErrorMap(WebClientResponseException.class, ex -> logAndWrap("transcription", ex))
                .onErrorMap(ex -> !(ex instanceof OpenAiChatException),
                        ex -> new OpenAiChatException("Failed to transcribe audio", ex));
    }

    private Map<String, Object> payload(Request request, boolean stream) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", request.model());
        payload.put("messages", request.messages());
        payload.put("stream", stream);
        if (request.temperature() != null) {
            payload.put("temperature", request.temperature());
        }
        if (request.maxTokens() != null) {
            payload.put("max_tokens", request.maxTokens());
        }
        return payload;
    }

    private OpenAiChatException logAndWrap(String operation, WebClientResponseException exception) {
        HttpStatusCode status = exception.getStatusCode();
        log.warn("OpenAI {} returned {}: {}", operation, status, exception.getResponseBodyAsString());
        return new OpenAiChatException("OpenAI " + operation + " returned " + status.value(), exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(String model,
                          List<Message> messages,
                          Double temperature,
                          Integer maxTokens) {
    }

    public record Message(String role, String content) {
    }

    public record ChatCompletionResponse(List<Choice> choices, Usage usage) {

        public Choice firstChoice() {
            return choices == null || choices.isEmpty() ? null : choices.get(0);
        }
    }

    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    public record Usage(@JsonProperty("total_tokens") int totalTokens,
                        @JsonProperty("prompt_tokens") int promptTokens,
                        @JsonProperty("completion_tokens") int completionTokens) {
    }

    public record StreamEvent(String data, boolean done) {

        public static final StreamEvent DONE = new StreamEvent("[DONE]", true);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SpeechPayload(String model,
                                String input,
                                String voice,
                                @JsonProperty("response_format") String responseFormat) {
    }

    public record TranscriptionResponse(String text) {
    }

    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String filename;

        private NamedByteArrayResource(byte[] content, String filename) {
            super(content);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
