package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.RestaurantAiConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RestaurantAiConfigRepository extends JpaRepository<RestaurantAiConfigEntity, String> {
}
