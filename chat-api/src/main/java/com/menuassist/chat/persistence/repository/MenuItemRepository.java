package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.MenuItemEntity;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MenuItemRepository extends JpaRepository<MenuItemEntity, String> {

    @EntityGraph(attributePaths = "category")
    List<MenuItemEntity> findByRestaurantIdAndAvailableTrue(String restaurantId);
}
