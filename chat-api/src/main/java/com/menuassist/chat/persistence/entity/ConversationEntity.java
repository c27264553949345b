package com.menuassist.chat.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.OffsetDateTime;

@Entity
@Table(name = "conversations",
        uniqueConstraints = @UniqueConstraint(name = "unique_restaurant_session", columnNames = {"restaurant_id", "session_id"}))
public class ConversationEntity {

    @Id
    @Column(name = "conversation_id", nullable = false, updatable = false, length = 36)
    private String conversationId;

    @Column(name = "restaurant_id", nullable = false, updatable = false, length = 64)
    private String restaurantId;

    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "last_activity", nullable = false)
    private OffsetDateTime lastActivity;

    @Column(name = "next_sequence", nullable = false)
    private int nextSequence;

    protected ConversationEntity() {
    }

    public ConversationEntity(String conversationId, String restaurantId, String sessionId) {
        this.conversationId = conversationId;
        this.restaurantId = restaurantId;
        this.sessionId = sessionId;
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (startedAt == null) {
            startedAt = now;
        }
        if (lastActivity == null) {
            lastActivity = now;
        }
    }

    public void touch(OffsetDateTime activity) {
        if (lastActivity == null || activity.isAfter(lastActivity)) {
            lastActivity = activity;
        }
    }

    /**
     * Returns the first of {@code count} consecutive sequence numbers and moves the counter past them.
     */
    public int reserveSequences(int count) {
        int first = nextSequence;
        nextSequence += count;
        return first;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getRestaurantId() {
        return restaurantId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getLastActivity() {
        return lastActivity;
    }

    public int getNextSequence() {
        return nextSequence;
    }
}
