package com.menuassist.chat.persistence.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Menu item row owned by the menu service. Ingredient and allergen names are kept in their
 * published order.
 */
@Entity
@Immutable
@Table(name = "menu_items")
public class MenuItemEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "restaurant_id", nullable = false, length = 64)
    private String restaurantId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private MenuCategoryEntity category;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "is_available", nullable = false)
    private boolean available;

    @Column(name = "is_signature", nullable = false)
    private boolean signature;

    @Column(name = "preparation_time")
    private Integer preparationMinutes;

    @Column(name = "display_order", nullable = false)
    private int displayOrder;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "menu_item_ingredients", joinColumns = @JoinColumn(name = "menu_item_id"))
    @OrderColumn(name = "position")
    @Column(name = "ingredient_name", nullable = false)
    private List<String> ingredients = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "menu_item_allergens", joinColumns = @JoinColumn(name = "menu_item_id"))
    @OrderColumn(name = "position")
    @Column(name = "allergen", nullable = false)
    private List<String> allergens = new ArrayList<>();

    protected MenuItemEntity() {
    }

    public MenuItemEntity(String id,
                          String restaurantId,
                          MenuCategoryEntity category,
                          String name,
                          String description,
                          BigDecimal price,
                          boolean available,
                          boolean signature,
                          Integer preparationMinutes,
                          int displayOrder,
                          List<String> ingredients,
                          List<String> allergens) {
        this.id = id;
        this.restaurantId = restaurantId;
        this.category = category;
        this.name = name;
        this.description = description;
        this.price = price;
        this.available = available;
        this.signature = signature;
        this.preparationMinutes = preparationMinutes;
        this.displayOrder = displayOrder;
        this.ingredients = new ArrayList<>(ingredients);
        this.allergens = new ArrayList<>(allergens);
    }

    public String getId() {
        return id;
    }

    public String getRestaurantId() {
        return restaurantId;
    }

    public MenuCategoryEntity getCategory() {
        return category;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public boolean isAvailable() {
        return available;
    }

    public boolean isSignature() {
        return signature;
    }

    public Integer getPreparationMinutes() {
        return preparationMinutes;
    }

    public int getDisplayOrder() {
        return displayOrder;
    }

    public List<String> getIngredients() {
        return ingredients;
    }

    public List<String> getAllergens() {
        return allergens;
    }
}
