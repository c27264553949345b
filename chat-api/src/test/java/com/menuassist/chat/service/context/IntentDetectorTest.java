package com.menuassist.chat.service.context;

import com.menuassist.chat.model.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IntentDetectorTest {

    private final IntentDetector detector = new IntentDetector();

    @Test
    void orderingKeywordsWinOverBrowsingKeywords() {
        assertThat(detector.detect("What is good? I'll take two OG cookies", List.of()))
                .isEqualTo(CustomerIntent.ORDERING);
    }

    @Test
    void questionsAboutTheMenuAreBrowsing() {
        assertThat(detector.detect("What do you recommend?", List.of()))
                .isEqualTo(CustomerIntent.BROWSING);
    }

    @Test
    void undecidedMessageInheritsLatestCustomerIntent() {
        List<ChatMessage> newestFirst = List.of(
                ChatMessage.assistant("What would you like to order?", Map.of()),
                ChatMessage.customer("Can I get the Boneless"),
                ChatMessage.customer("tell me about your cookies")
        );

        assertThat(detector.detect("yes please", newestFirst)).isEqualTo(CustomerIntent.ORDERING);
    }

    @Test
    void assistantMessagesDoNotDecideIntent() {
        List<ChatMessage> newestFirst = List.of(ChatMessage.assistant("Would you like to order?", Map.of()));

        assertThat(detector.detect("sure", newestFirst)).isEqualTo(CustomerIntent.BROWSING);
    }

    @Test
    void defaultsToBrowsing() {
        assertThat(detector.detect("ok", List.of())).isEqualTo(CustomerIntent.BROWSING);
        assertThat(detector.decisive("ok")).isEmpty();
    }
}
