package com.menuassist.chat.service.menu;

import com.menuassist.chat.persistence.entity.MenuCategoryEntity;
import com.menuassist.chat.persistence.entity.MenuItemEntity;
import com.menuassist.chat.persistence.entity.RestaurantEntity;
import com.menuassist.chat.persistence.repository.MenuCategoryRepository;
import com.menuassist.chat.persistence.repository.MenuItemRepository;
import com.menuassist.chat.persistence.repository.RestaurantRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JpaMenuCatalogTest {

    @Autowired
    private JpaMenuCatalog menuCatalog;

    @Autowired
    private RestaurantRepository restaurantRepository;

    @Autowired
    private MenuCategoryRepository categoryRepository;

    @Autowired
    private MenuItemRepository itemRepository;

    @Test
    void readsActiveRestaurantWithAvatar() {
        restaurantRepository.save(new RestaurantEntity("rest-menu-1", "Crumbl Corner", "bakery", "Warm cookies",
                "{\"name\":\"Cookie\",\"tone\":\"playful\",\"special_instructions\":\"Mention fresh batches\"}", true));
        restaurantRepository.save(new RestaurantEntity("rest-menu-closed", "Closed", null, null, null, false));

        RestaurantProfile profile = menuCatalog.findRestaurant("rest-menu-1").orElseThrow();

        assertThat(profile.name()).isEqualTo("Crumbl Corner");
        assertThat(profile.avatar().name()).isEqualTo("Cookie");
        assertThat(profile.avatar().tone()).isEqualTo("playful");
        assertThat(profile.avatar().specialInstructions()).isEqualTo("Mention fresh batches");
        assertThat(menuCatalog.findRestaurant("rest-menu-closed")).isEmpty();
    }

    @Test
    void unreadableAvatarUsesDefaults() {
        restaurantRepository.save(new RestaurantEntity("rest-menu-2", "Broken Avatar", null, null, "{oops", true));

        assertThat(menuCatalog.findRestaurant("rest-menu-2").orElseThrow().avatar().name())
                .isEqualTo(AvatarProfile.DEFAULT_NAME);
    }

    @Test
    void availableItemsFollowCategoryThenItemOrder() {
        MenuCategoryEntity drinks = categoryRepository.save(new MenuCategoryEntity("cat-drinks", "rest-menu-3", "Drinks", 2));
        MenuCategoryEntity cookies = categoryRepository.save(new MenuCategoryEntity("cat-cookies", "rest-menu-3", "Cookies", 1));
        itemRepository.save(new MenuItemEntity("m-milk", "rest-menu-3", drinks, "Milk", null,
                new BigDecimal("1.50"), true, false, null, 1, List.of(), List.of("dairy")));
        itemRepository.save(new MenuItemEntity("m-og", "rest-menu-3", cookies, "OG", "Chocolate chunks",
                new BigDecimal("4.49"), true, true, 10, 2, List.of("flour", "chocolate", "butter"), List.of("wheat", "dairy")));
        itemRepository.save(new MenuItemEntity("m-boneless", "rest-menu-3", cookies, "Boneless", null,
                new BigDecimal("3.99"), true, false, null, 1, List.of(), List.of()));
        itemRepository.save(new MenuItemEntity("m-gone", "rest-menu-3", cookies, "Retired", null,
                new BigDecimal("2.00"), false, false, null, 0, List.of(), List.of()));
        itemRepository.save(new MenuItemEntity("m-loose", "rest-menu-3", null, "Sticker", null,
                new BigDecimal("0.50"), true, false, null, 0, List.of(), List.of()));

        List<MenuItemKnowledge> items = menuCatalog.availableItems("rest-menu-3");

        assertThat(items).extracting(MenuItemKnowledge::name).containsExactly("Boneless", "OG", "Milk", "Sticker");
        MenuItemKnowledge og = items.get(1);
        assertThat(og.category()).isEqualTo("Cookies");
        assertThat(og.ingredients()).containsExactly("flour", "chocolate", "butter");
        assertThat(og.allergens()).containsExactly("wheat", "dairy");
        assertThat(og.signature()).isTrue();
        assertThat(og.preparationMinutes()).isEqualTo(10);
        assertThat(items.get(3).category()).isNull();
    }
}
