package com.menuassist.chat.service.knowledge;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a customer message to a fact question about a single menu item.
 * <p>
 * Rules are evaluated in declaration order (description, ingredients, allergens, price,
 * preparation) and the first pattern found anywhere in the lower-cased message wins. Its first
 * capture group is the candidate item name.
 */
@Component
public class QuestionClassifier {

    private static final String ARTICLE = "(?:the |your |a |an )?";

    private static final List<Rule> RULES = List.of(
            rule(QuestionType.DESCRIPTION, "tell me (?:more )?about " + ARTICLE + "(.+)"),
            rule(QuestionType.DESCRIPTION, "what(?: is|'s) " + ARTICLE
                    + "(?!price\\b|cost\\b|ingredients?\\b|allergens?\\b|preparation\\b|in\\b)"
                    + "(?!.*\\b(?:made (?:of|with)|costs?|price)\\b)(.+)"),
            rule(QuestionType.DESCRIPTION, "describe " + ARTICLE + "(.+)"),

            rule(QuestionType.INGREDIENTS, "what are (?:the )?ingredients (?:in|of|for) " + ARTICLE + "(.+)"),
            rule(QuestionType.INGREDIENTS, "ingredients (?:in|of|for) " + ARTICLE + "(.+)"),
            rule(QuestionType.INGREDIENTS, "what(?: is|'s) in " + ARTICLE + "(.+)"),
            rule(QuestionType.INGREDIENTS, "what(?: is|'s) " + ARTICLE + "(.+?) made (?:of|with)"),

            rule(QuestionType.ALLERGENS, "allergens? (?:in|of|for) " + ARTICLE + "(.+)"),
            rule(QuestionType.ALLERGENS, "(?:does|do) " + ARTICLE + "(.+?) (?:contain|have) (?:any )?"
                    + "(?:allergens|nuts|peanuts|tree nuts|gluten|wheat|dairy|milk|eggs?|soy|sesame|shellfish|fish)\\b"),
            rule(QuestionType.ALLERGENS, "is " + ARTICLE + "(.+?) (?:gluten|dairy|nut|peanut|egg|soy)[- ]free"),

            rule(QuestionType.PRICE, "how much (?:is|are|does|for) " + ARTICLE + "(.+?)(?: cost)?[?.!]*$"),
            rule(QuestionType.PRICE, "(?:price|cost) (?:of|for) " + ARTICLE + "(.+)"),
            rule(QuestionType.PRICE, "what does " + ARTICLE + "(.+?) cost"),

            rule(QuestionType.PREPARATION, "how long (?:does it take )?to (?:make|prepare|bake) " + ARTICLE + "(.+)"),
            rule(QuestionType.PREPARATION, "preparation time (?:of|for) " + ARTICLE + "(.+)"),
            rule(QuestionType.PREPARATION, "how long (?:does|do|will) " + ARTICLE + "(?!it\\b)(.+?) take")
    );

    public Optional<ClassifiedQuestion> classify(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String normalized = message.toLowerCase(Locale.ROOT).trim();
        for (Rule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(normalized);
            if (matcher.find()) {
                String candidate = matcher.group(1).trim();
                if (candidate.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new ClassifiedQuestion(rule.type(), candidate));
            }
        }
        return Optional.empty();
    }

    private static Rule rule(QuestionType type, String regex) {
        return new Rule(type, Pattern.compile(regex));
    }

    private record Rule(QuestionType type, Pattern pattern) {
    }
}
