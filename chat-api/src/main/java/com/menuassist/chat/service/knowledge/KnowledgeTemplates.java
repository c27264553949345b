package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.service.menu.MenuItemKnowledge;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed answer templates filled strictly from menu item fields. Nothing here paraphrases or infers.
 */
public final class KnowledgeTemplates {

    private KnowledgeTemplates() {
    }

    public static String render(QuestionType type, MenuItemKnowledge item) {
        return switch (type) {
            case DESCRIPTION -> description(item);
            case INGREDIENTS -> ingredients(item);
            case ALLERGENS -> allergens(item);
            case PRICE -> price(item);
            case PREPARATION -> preparation(item);
        };
    }

    public static String formatPrice(BigDecimal price) {
        return "$" + price.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String description(MenuItemKnowledge item) {
        StringBuilder builder = new StringBuilder(item.name());
        String description = item.description() == null ? "" : item.description().trim();
        if (description.isEmpty()) {
            builder.append('.');
        } else {
            builder.append(" - ").append(description);
            if (!endsWithTerminalPunctuation(description)) {
                builder.append('.');
            }
        }
        if (hasPrice(item)) {
            builder.append(" This delicious item is priced at ").append(formatPrice(item.price())).append('.');
        }
        if (item.signature()) {
            builder.append(" This is one of our signature items!");
        }
        return builder.toString();
    }

    private static String ingredients(MenuItemKnowledge item) {
        if (item.ingredients().isEmpty()) {
            return "I don't have the specific ingredient list for " + item.name() + " available right now.";
        }
        return "The " + item.name() + " contains: " + String.join(", ", item.ingredients()) + ".";
    }

    private static String allergens(MenuItemKnowledge item) {
        if (item.allergens().isEmpty()) {
            return "I don't have specific allergen information for " + item.name()
                    + ". Please let our staff know about any allergies.";
        }
        return "The " + item.name() + " contains the following allergens: " + String.join(", ", item.allergens())
                + ". Please let us know if you have any specific allergies!";
    }

    private static String price(MenuItemKnowledge item) {
        if (!hasPrice(item)) {
            return "I don't have the current price for " + item.name() + ". Please check with our staff.";
        }
        return "The " + item.name() + " costs " + formatPrice(item.price()) + ".";
    }

    private static String preparation(MenuItemKnowledge item) {
        if (item.preparationMinutes() == null || item.preparationMinutes() <= 0) {
            return "I don't have the specific preparation time for " + item.name() + ".";
        }
        return "The " + item.name() + " takes approximately " + item.preparationMinutes() + " minutes to prepare.";
    }

    private static boolean hasPrice(MenuItemKnowledge item) {
        return item.price() != null && item.price().signum() > 0;
    }

    private static boolean endsWithTerminalPunctuation(String text) {
        char last = text.charAt(text.length() - 1);
        return last == '.' || last == '!' || last == '?';
    }
}
