package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.MessageEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

public interface MessageRepository extends JpaRepository<MessageEntity, String> {

    List<MessageEntity> findByConversationIdOrderBySequenceDesc(String conversationId, Pageable pageable);

    List<MessageEntity> findByConversationIdOrderBySequenceAsc(String conversationId);

    @Query("select count(m) from MessageEntity m, ConversationEntity c "
            + "where m.conversationId = c.conversationId and c.restaurantId = :restaurantId and m.createdAt >= :since")
    long countForRestaurantSince(@Param("restaurantId") String restaurantId, @Param("since") OffsetDateTime since);
}
