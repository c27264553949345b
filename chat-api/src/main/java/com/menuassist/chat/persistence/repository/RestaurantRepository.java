package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.RestaurantEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RestaurantRepository extends JpaRepository<RestaurantEntity, String> {

    Optional<RestaurantEntity> findByIdAndActiveTrue(String id);
}
