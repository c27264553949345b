package com.menuassist.chat.service.menu;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.menuassist.chat.persistence.entity.MenuCategoryEntity;
import com.menuassist.chat.persistence.entity.MenuItemEntity;
import com.menuassist.chat.persistence.entity.RestaurantEntity;
import com.menuassist.chat.persistence.repository.MenuItemRepository;
import com.menuassist.chat.persistence.repository.RestaurantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class JpaMenuCatalog implements MenuCatalog {

    private static final Logger log = LoggerFactory.getLogger(JpaMenuCatalog.class);

    private static final Comparator<MenuItemEntity> DISPLAY_ORDER = Comparator
            .comparing((MenuItemEntity item) -> item.getCategory() == null)
            .thenComparingInt(item -> item.getCategory() == null ? 0 : item.getCategory().getDisplayOrder())
            .thenComparing(item -> item.getCategory() == null ? "" : item.getCategory().getName())
            .thenComparingInt(MenuItemEntity::getDisplayOrder)
            .thenComparing(MenuItemEntity::getName);

    private final RestaurantRepository restaurantRepository;
    private final MenuItemRepository menuItemRepository;
    private final ObjectMapper objectMapper;

    public JpaMenuCatalog(RestaurantRepository restaurantRepository,
                          MenuItemRepository menuItemRepository,
                          ObjectMapper objectMapper) {
        this.restaurantRepository = restaurantRepository;
        this.menuItemRepository = menuItemRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<RestaurantProfile> findRestaurant(String restaurantId) {
        return restaurantRepository.findByIdAndActiveTrue(restaurantId).map(this::toProfile);
    }

    @Override
    public List<MenuItemKnowledge> availableItems(String restaurantId) {
        return menuItemRepository.findByRestaurantIdAndAvailableTrue(restaurantId).stream()
                .sorted(DISPLAY_ORDER)
                .map(this::toKnowledge)
                .toList();
    }

    private RestaurantProfile toProfile(RestaurantEntity entity) {
        return new RestaurantProfile(
                entity.getId(),
                entity.getName(),
                entity.getCuisineType(),
                entity.getDescription(),
                parseAvatar(entity)
        );
    }

    private MenuItemKnowledge toKnowledge(MenuItemEntity entity) {
        MenuCategoryEntity category = entity.getCategory();
        return new MenuItemKnowledge(
                entity.getId(),
                entity.getName(),
                category == null ? null : category.getName(),
                entity.getPrice(),
                entity.getDescription(),
                List.copyOf(entity.getIngredients()),
                new LinkedHashSet<>(entity.getAllergens()),
                entity.isSignature(),
                entity.getPreparationMinutes()
        );
    }

    private AvatarProfile parseAvatar(RestaurantEntity entity) {
        String json = entity.getAvatarConfigJson();
        if (json == null || json.isBlank()) {
            return AvatarProfile.defaults();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            return new AvatarProfile(
                    text(node, "name"),
                    text(node, "personality"),
                    text(node, "tone"),
                    text(node, "greeting"),
                    text(node, "special_instructions")
            );
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring unreadable avatar config for restaurant {}: {}", entity.getId(), ex.getOriginalMessage());
            return AvatarProfile.defaults();
        }
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
