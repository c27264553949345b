package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.service.menu.MenuItemKnowledge;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the menu item a free-text candidate name refers to.
 * <p>
 * An exact normalized match wins. Otherwise the item whose name and the candidate contain one
 * another on word boundaries is chosen, preferring the longest item name and then menu display
 * order, so "og chip cookie" resolves to "OG Chip" rather than "Chip". Words compare equal when
 * one is the other plus a plural "s" or "es", so "chocolate chips" finds "Chocolate Chip".
 */
@Component
public class ItemResolver {

    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @param items the restaurant's available items in menu display order
     */
    public Optional<MenuItemKnowledge> resolve(List<MenuItemKnowledge> items, String candidateName) {
        String candidate = normalize(candidateName);
        if (candidate.isEmpty() || items == null || items.isEmpty()) {
            return Optional.empty();
        }
        for (MenuItemKnowledge item : items) {
            if (normalize(item.name()).equals(candidate)) {
                return Optional.of(item);
            }
        }
        MenuItemKnowledge best = null;
        int bestLength = -1;
        for (MenuItemKnowledge item : items) {
            String name = normalize(item.name());
            if (name.isEmpty() || !overlaps(name, candidate)) {
                continue;
            }
            if (name.length() > bestLength) {
                best = item;
                bestLength = name.length();
            }
        }
        return Optional.ofNullable(best);
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String stripped = PUNCTUATION.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private boolean overlaps(String name, String candidate) {
        String[] nameWords = name.split(" ");
        String[] candidateWords = candidate.split(" ");
        return containsRun(candidateWords, nameWords) || containsRun(nameWords, candidateWords);
    }

    private static boolean containsRun(String[] words, String[] run) {
        for (int start = 0; start + run.length <= words.length; start++) {
            boolean matched = true;
            for (int i = 0; i < run.length && matched; i++) {
                matched = sameWord(words[start + i], run[i]);
            }
            if (matched) {
                return true;
            }
        }
        return false;
    }

    static boolean sameWord(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        String longer = a.length() > b.length() ? a : b;
        String shorter = longer == a ? b : a;
        return longer.equals(shorter + "s") || longer.equals(shorter + "es");
    }
}
