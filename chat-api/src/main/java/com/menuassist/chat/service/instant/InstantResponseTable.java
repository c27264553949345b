package com.menuassist.chat.service.instant;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canned replies for greetings, thanks and farewells. Replies do not depend on the restaurant or
 * the session, so they are answered before any cache or database access.
 * <p>
 * An exact phrase match wins. Otherwise the first phrase, in table order, that contains or is
 * contained in the message on word boundaries is used, so "hi" never matches inside "chip".
 */
@Component
public class InstantResponseTable {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}' ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_EXTRA_WORDS = 3;

    private static final Map<String, String> RESPONSES;

    static {
        Map<String, String> responses = new LinkedHashMap<>();
        responses.put("hello", "Hello! Welcome in. What can I help you find on the menu today?");
        responses.put("hi", "Hi there! What are you in the mood for today?");
        responses.put("hey", "Hey! Great to see you. What can I get for you today?");
        responses.put("good morning", "Good morning! What can I help you find to start your day?");
        responses.put("good afternoon", "Good afternoon! Ready for something tasty?");
        responses.put("good evening", "Good evening! What can I help you with tonight?");
        responses.put("thank you", "You're very welcome! Enjoy your meal and have a wonderful day!");
        responses.put("thanks", "My pleasure! Enjoy!");
        responses.put("goodbye", "Goodbye! It was lovely helping you today. Come back soon!");
        responses.put("bye", "Bye! Thanks for stopping by. Come back soon!");
        RESPONSES = Collections.unmodifiableMap(responses);
    }

    public Optional<InstantReply> match(String message) {
        String normalized = normalize(message);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        String exact = RESPONSES.get(normalized);
        if (exact != null) {
            return Optional.of(new InstantReply(normalized, exact));
        }
        String paddedMessage = " " + normalized + " ";
        for (Map.Entry<String, String> entry : RESPONSES.entrySet()) {
            String paddedPhrase = " " + entry.getKey() + " ";
            boolean phraseInMessage = paddedMessage.contains(paddedPhrase)
                    && wordCount(normalized) - wordCount(entry.getKey()) <= MAX_EXTRA_WORDS;
            if (phraseInMessage || paddedPhrase.contains(paddedMessage)) {
                return Optional.of(new InstantReply(entry.getKey(), entry.getValue()));
            }
        }
        return Optional.empty();
    }

    Map<String, String> responses() {
        return RESPONSES;
    }

    private static int wordCount(String text) {
        return text.split(" ").length;
    }

    private static String normalize(String message) {
        if (message == null) {
            return "";
        }
        String lowered = NON_WORD.matcher(message.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(lowered).replaceAll(" ").trim();
    }
}
