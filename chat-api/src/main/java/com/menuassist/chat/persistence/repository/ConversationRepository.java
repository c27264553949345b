package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.ConversationEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface ConversationRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findByRestaurantIdAndSessionId(String restaurantId, String sessionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from ConversationEntity c where c.conversationId = :conversationId")
    Optional<ConversationEntity> findForUpdate(@Param("conversationId") String conversationId);

    long countByRestaurantIdAndLastActivityGreaterThanEqual(String restaurantId, OffsetDateTime since);
}
