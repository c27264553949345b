package com.menuassist.chat.service.generation.provider;

import com.menuassist.chat.service.generation.GenerationParameters;
import com.menuassist.chat.service.generation.PromptMessage;
import com.menuassist.chat.service.generation.ProviderException;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OfflineAiProviderTest {

    private final OfflineAiProvider provider = new OfflineAiProvider();
    private final GenerationParameters parameters =
            new GenerationParameters("offline", "none", 150, 0.7, Duration.ofSeconds(5));

    @Test
    void repliesByKeywordOfLastCustomerMessage() {
        List<PromptMessage> messages = List.of(
                PromptMessage.system("You are Cookie."),
                PromptMessage.user("Any allergen info for the OG?"));

        StepVerifier.create(provider.generateText(messages, parameters))
                .assertNext(text -> assertThat(text).startsWith("For allergen information"))
                .verifyComplete();
        assertThat(OfflineAiProvider.reply("something else")).isEqualTo(OfflineAiProvider.DEFAULT_REPLY);
    }

    @Test
    void streamedFragmentsJoinToTheReply() {
        List<PromptMessage> messages = List.of(PromptMessage.user("show me the menu"));

        String joined = String.join("", provider.streamText(messages, parameters).collectList().block());

        assertThat(joined).isEqualTo(OfflineAiProvider.reply("show me the menu"));
    }

    @Test
    void speechIsUnavailable() {
        StepVerifier.create(provider.synthesizeSpeech("hi", "nova"))
                .expectError(ProviderException.class)
                .verify();
    }

    @Test
    void demoAnswersAreNotReusableAndNoVoicesAreOffered() {
        assertThat(provider.answersCacheable()).isFalse();
        assertThat(provider.availableVoices()).isEmpty();
    }
}
