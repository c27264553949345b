package com.menuassist.chat.service.generation.provider.openai;

import com.menuassist.chat.service.generation.GenerationParameters;
import com.menuassist.chat.service.generation.PromptMessage;
import com.menuassist.chat.service.generation.ProviderException;
import com.menuassist.chat.service.generation.ProviderFailure;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiProviderTest {

    private static final GenerationParameters PARAMETERS =
            new GenerationParameters("openai", "gpt-4o-mini", 150, 0.7, Duration.ofSeconds(5));
    private static final List<PromptMessage> MESSAGES =
            List.of(PromptMessage.system("You are Cookie."), PromptMessage.user("What is good?"));

    private final List<ClientRequest> requests = new ArrayList<>();

    private OpenAiProvider provider(ClientResponse response) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://llm.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(response);
                })
                .build();
        return new OpenAiProvider(new OpenAiChatClient(webClient),
                Jackson2ObjectMapperBuilder.json().build(), "sk-test", "tts-1", "whisper-1");
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    @Test
    void completionReturnsFirstChoiceContent() {
        OpenAiProvider provider = provider(json("""
                {"id":"c1","choices":[{"index":0,"message":{"role":"assistant","content":" Try the OG. "},
                "finish_reason":"stop"}],"usage":{"total_tokens":12,"prompt_tokens":8,"completion_tokens":4}}
                """));

        StepVerifier.create(provider.generateText(MESSAGES, PARAMETERS))
                .expectNext("Try the OG.")
                .verifyComplete();
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v1/chat/completions");
    }

    @Test
    void completionWithoutChoicesIsMalformed() {
        OpenAiProvider provider = provider(json("{\"choices\":[]}"));

        StepVerifier.create(provider.generateText(MESSAGES, PARAMETERS))
                .expectErrorSatisfies(error -> assertThat(ProviderFailure.classify(error))
                        .isEqualTo(ProviderFailure.MALFORMED_RESPONSE))
                .verify();
    }

    @Test
    void httpErrorBecomesProviderError() {
        OpenAiProvider provider = provider(ClientResponse.create(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"error\":{\"message\":\"bad key\"}}")
                .build());

        StepVerifier.create(provider.generateText(MESSAGES, PARAMETERS))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(OpenAiChatException.class);
                    assertThat(((ProviderException) error).getFailure()).isEqualTo(ProviderFailure.ERROR);
                })
                .verify();
    }

    @Test
    void streamYieldsDeltasUntilDone() {
        OpenAiProvider provider = provider(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body("""
                        data: {"choices":[{"index":0,"delta":{"role":"assistant"}}]}

                        data: {"choices":[{"index":0,"delta":{"content":"Try "}}]}

                        data: {"choices":[{"index":0,"delta":{"content":"the OG."},"finish_reason":null}]}

                        data: [DONE]

                        """)
                .build());

        StepVerifier.create(provider.streamText(MESSAGES, PARAMETERS))
                .expectNext("Try ", "the OG.")
                .verifyComplete();
    }

    @Test
    void unparseableChunkIsMalformed() {
        OpenAiProvider provider = provider(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                .body("data: {not json\n\n")
                .build());

        StepVerifier.create(provider.streamText(MESSAGES, PARAMETERS))
                .expectErrorSatisfies(error -> assertThat(ProviderFailure.classify(error))
                        .isEqualTo(ProviderFailure.MALFORMED_RESPONSE))
                .verify();
    }

    @Test
    void isConfiguredOnlyWithApiKey() {
        OpenAiChatClient client = new OpenAiChatClient(WebClient.create());

        assertThat(new OpenAiProvider(client, Jackson2ObjectMapperBuilder.json().build(), "", "tts-1", "whisper-1")
                .isConfigured()).isFalse();
        assertThat(provider(json("{}")).isConfigured()).isTrue();
    }
}
