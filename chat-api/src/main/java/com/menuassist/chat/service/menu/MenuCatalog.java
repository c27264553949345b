package com.menuassist.chat.service.menu;

import java.util.List;
import java.util.Optional;

/**
 * Read access to restaurant and menu data owned by the menu service.
 */
public interface MenuCatalog {

    Optional<RestaurantProfile> findRestaurant(String restaurantId);

    /**
     * Available items in menu display order: category order first, then item order within a category.
     */
    List<MenuItemKnowledge> availableItems(String restaurantId);
}
