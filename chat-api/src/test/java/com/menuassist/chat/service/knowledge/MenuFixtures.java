package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.service.menu.MenuItemKnowledge;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

final class MenuFixtures {

    static final MenuItemKnowledge BONELESS = new MenuItemKnowledge(
            "item-boneless",
            "Boneless",
            "Cookies",
            new BigDecimal("3.99"),
            "Our original signature warm gourmet cookie with a perfectly balanced buttery flavor",
            List.of("flour", "butter", "brown sugar"),
            Set.of("wheat", "dairy"),
            false,
            12
    );

    static final MenuItemKnowledge OG = new MenuItemKnowledge(
            "item-og",
            "OG",
            "Cookies",
            new BigDecimal("4.49"),
            "Semi-sweet chocolate chunks",
            List.of("flour", "chocolate"),
            Set.of("wheat"),
            true,
            null
    );

    static final MenuItemKnowledge CHIP = new MenuItemKnowledge(
            "item-chip",
            "Chip",
            "Cookies",
            new BigDecimal("3.49"),
            null,
            List.of(),
            Set.of(),
            false,
            null
    );

    static final MenuItemKnowledge OG_CHIP = new MenuItemKnowledge(
            "item-og-chip",
            "OG Chip",
            "Cookies",
            new BigDecimal("4.99"),
            "Double chocolate.",
            List.of(),
            Set.of(),
            false,
            8
    );

    static final List<MenuItemKnowledge> MENU = List.of(BONELESS, OG, CHIP, OG_CHIP);

    private MenuFixtures() {
    }
}
