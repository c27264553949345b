package com.menuassist.chat.persistence.entity;

import com.menuassist.chat.model.MessageSender;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.OffsetDateTime;

@Entity
@Table(name = "messages",
        uniqueConstraints = @UniqueConstraint(name = "unique_conversation_sequence", columnNames = {"conversation_id", "sequence_number"}))
public class MessageEntity {

    @Id
    @Column(name = "message_id", nullable = false, updatable = false, length = 36)
    private String messageId;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 36)
    private String conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "sender_type", nullable = false, length = 20)
    private MessageSender sender;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "meta_data", columnDefinition = "text")
    private String metadataJson;

    @Column(name = "sequence_number", nullable = false)
    private int sequence;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected MessageEntity() {
    }

    public MessageEntity(String messageId,
                         String conversationId,
                         MessageSender sender,
                         String content,
                         String metadataJson,
                         int sequence,
                         OffsetDateTime createdAt) {
        this.messageId = messageId;
        this.conversationId = conversationId;
        this.sender = sender;
        this.content = content;
        this.metadataJson = metadataJson;
        this.sequence = sequence;
        this.createdAt = createdAt;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public String getMessageId() {
        return messageId;
    }

    public String getConversationId() {
        return conversationId;
    }

    public MessageSender getSender() {
        return sender;
    }

    public String getContent() {
        return content;
    }

    public String getMetadataJson() {
        return metadataJson;
    }

    public int getSequence() {
        return sequence;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
