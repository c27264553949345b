package com.menuassist.chat.service.suggestion;

import com.menuassist.chat.model.Recommendation;
import com.menuassist.chat.service.menu.MenuItemKnowledge;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Follow-up questions and item recommendations attached to each reply.
 */
@Component
public class SuggestionGenerator {

    static final int MAX_SUGGESTIONS = 3;
    static final int MAX_RECOMMENDATIONS = 3;

    private static final Pattern SPICY = Pattern.compile("\\b(?:spicy|hot|heat)\\b");
    private static final Pattern PLANT_BASED = Pattern.compile("\\b(?:vegetarian|vegan|plant)\\b");
    private static final Pattern ALLERGY = Pattern.compile("\\b(?:allergy|allergies|allergic|allergens?)\\b");

    private static final List<String> DEFAULTS = List.of(
            "Would you like to hear about our signature items?",
            "Are you looking for something specific?",
            "Would you like to know about today's specials?"
    );

    public List<String> suggestions(String customerMessage) {
        String lowered = customerMessage == null ? "" : customerMessage.toLowerCase(Locale.ROOT);
        List<String> suggestions = new ArrayList<>();
        if (SPICY.matcher(lowered).find()) {
            suggestions.add("What's your spice tolerance level?");
            suggestions.add("Would you like to see our mildest options?");
        }
        if (PLANT_BASED.matcher(lowered).find()) {
            suggestions.add("Do you have any other dietary restrictions?");
            suggestions.add("Are you interested in our vegetarian specialties?");
        }
        if (ALLERGY.matcher(lowered).find()) {
            suggestions.add("Which specific allergens should I help you avoid?");
            suggestions.add("Would you like me to recommend allergen-free options?");
        }
        if (suggestions.isEmpty()) {
            return DEFAULTS;
        }
        return List.copyOf(suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size())));
    }

    /**
     * Menu items named in the answer, in menu order.
     */
    public List<Recommendation> recommendations(String answer, List<MenuItemKnowledge> menu) {
        if (answer == null || answer.isBlank()) {
            return List.of();
        }
        String lowered = answer.toLowerCase(Locale.ROOT);
        List<Recommendation> recommendations = new ArrayList<>();
        for (MenuItemKnowledge item : menu) {
            if (recommendations.size() == MAX_RECOMMENDATIONS) {
                break;
            }
            Pattern name = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(item.name().toLowerCase(Locale.ROOT))
                    + "(?![\\p{L}\\p{N}])");
            if (name.matcher(lowered).find()) {
                recommendations.add(new Recommendation(item.id(), item.name(), item.price()));
            }
        }
        return recommendations;
    }
}
