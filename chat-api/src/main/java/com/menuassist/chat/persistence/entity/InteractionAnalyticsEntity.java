package com.menuassist.chat.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "interaction_analytics")
public class InteractionAnalyticsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false, length = 64)
    private String restaurantId;

    @Column(name = "conversation_id", length = 36)
    private String conversationId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "event_data", columnDefinition = "text")
    private String eventDataJson;

    @Column(name = "timestamp", nullable = false)
    private OffsetDateTime timestamp;

    protected InteractionAnalyticsEntity() {
    }

    public InteractionAnalyticsEntity(String restaurantId, String conversationId, String eventType, String eventDataJson) {
        this.restaurantId = restaurantId;
        this.conversationId = conversationId;
        this.eventType = eventType;
        this.eventDataJson = eventDataJson;
    }

    @PrePersist
    void onCreate() {
        if (timestamp == null) {
            timestamp = OffsetDateTime.now();
        }
    }

    public Long getId() {
        return id;
    }

    public String getRestaurantId() {
        return restaurantId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEventDataJson() {
        return eventDataJson;
    }

    public OffsetDateTime getTimestamp() {
        return timestamp;
    }
}
