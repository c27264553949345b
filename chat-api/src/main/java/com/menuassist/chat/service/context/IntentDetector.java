package com.menuassist.chat.service.context;

import com.menuassist.chat.model.ChatMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Keyword heuristics telling browsing from ordering. Ordering keywords win over browsing ones;
 * a message with neither inherits the intent of the latest decisive customer message.
 */
@Component
public class IntentDetector {

    private static final Pattern ORDERING = Pattern.compile(
            "\\b(?:i'?ll (?:have|take|get|do)|i will (?:have|take|get)|i'?d like (?:to order|to get|to buy|one|two|a|an)|"
                    + "i want (?:to order|to buy|one|two|a|an)|can i (?:get|order|have)|order|buy|purchase|checkout|"
                    + "add (?:it|that|one|a|an)|make it a combo|to go|pick ?up|ring (?:it|me) up)\\b");

    private static final Pattern BROWSING = Pattern.compile(
            "\\b(?:what(?:'s| is| are| do)|tell me|describe|recommend|suggest|options?|menu|popular|favou?rite|"
                    + "just looking|browsing|curious|difference|which one|anything (?:with|without))\\b");

    public CustomerIntent detect(String message, List<ChatMessage> historyNewestFirst) {
        Optional<CustomerIntent> current = decisive(message);
        if (current.isPresent()) {
            return current.get();
        }
        for (ChatMessage previous : historyNewestFirst) {
            if (!previous.fromCustomer()) {
                continue;
            }
            Optional<CustomerIntent> inherited = decisive(previous.content());
            if (inherited.isPresent()) {
                return inherited.get();
            }
        }
        return CustomerIntent.BROWSING;
    }

    Optional<CustomerIntent> decisive(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String lowered = message.toLowerCase(Locale.ROOT);
        if (ORDERING.matcher(lowered).find()) {
            return Optional.of(CustomerIntent.ORDERING);
        }
        if (BROWSING.matcher(lowered).find()) {
            return Optional.of(CustomerIntent.BROWSING);
        }
        return Optional.empty();
    }
}
