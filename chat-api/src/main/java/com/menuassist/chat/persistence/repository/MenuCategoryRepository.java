package com.menuassist.chat.persistence.repository;

import com.menuassist.chat.persistence.entity.MenuCategoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MenuCategoryRepository extends JpaRepository<MenuCategoryEntity, String> {
}
