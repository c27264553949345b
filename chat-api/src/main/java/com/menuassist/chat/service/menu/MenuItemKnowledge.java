package com.menuassist.chat.service.menu;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of a menu item as the menu service publishes it. Ingredient order and allergen
 * order are preserved so templated answers are stable.
 */
public record MenuItemKnowledge(
        String id,
        String name,
        String category,
        BigDecimal price,
        String description,
        List<String> ingredients,
        Set<String> allergens,
        boolean signature,
        Integer preparationMinutes
) {

    public MenuItemKnowledge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        allergens = allergens == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(allergens));
    }
}
