package com.menuassist.chat.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

/**
 * Restaurant row owned by the restaurant service. Mapped read-only.
 */
@Entity
@Immutable
@Table(name = "restaurants")
public class RestaurantEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "cuisine_type", length = 100)
    private String cuisineType;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "avatar_config", columnDefinition = "text")
    private String avatarConfigJson;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    protected RestaurantEntity() {
    }

    public RestaurantEntity(String id, String name, String cuisineType, String description, String avatarConfigJson, boolean active) {
        this.id = id;
        this.name = name;
        this.cuisineType = cuisineType;
        this.description = description;
        this.avatarConfigJson = avatarConfigJson;
        this.active = active;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCuisineType() {
        return cuisineType;
    }

    public String getDescription() {
        return description;
    }

    public String getAvatarConfigJson() {
        return avatarConfigJson;
    }

    public boolean isActive() {
        return active;
    }
}
