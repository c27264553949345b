package com.menuassist.chat.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "restaurant_ai_configs")
public class RestaurantAiConfigEntity {

    @Id
    @Column(name = "restaurant_id", nullable = false, updatable = false, length = 64)
    private String restaurantId;

    @Column(name = "config_json", nullable = false, columnDefinition = "text")
    private String configJson;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected RestaurantAiConfigEntity() {
    }

    public RestaurantAiConfigEntity(String restaurantId, String configJson) {
        this.restaurantId = restaurantId;
        this.configJson = configJson;
    }

    @PrePersist
    @PreUpdate
    void onWrite() {
        updatedAt = OffsetDateTime.now();
    }

    public String getRestaurantId() {
        return restaurantId;
    }

    public String getConfigJson() {
        return configJson;
    }

    public void setConfigJson(String configJson) {
        this.configJson = configJson;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
