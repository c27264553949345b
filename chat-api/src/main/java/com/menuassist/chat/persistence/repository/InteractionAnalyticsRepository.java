package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.InteractionAnalyticsEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.OffsetDateTime;
import java.util.List;

public interface InteractionAnalyticsRepository extends JpaRepository<InteractionAnalyticsEntity, Long> {

    List<InteractionAnalyticsEntity> findByRestaurantIdOrderByIdAsc(String restaurantId);

    List<InteractionAnalyticsEntity> findByRestaurantIdAndTimestampGreaterThanEqual(String restaurantId, OffsetDateTime since);
}
