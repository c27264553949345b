package com.menuassist.chat.service.menu;

import java.util.Objects;

public record RestaurantProfile(
        String id,
        String name,
        String cuisineType,
        String description,
        AvatarProfile avatar
) {

    public RestaurantProfile {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        avatar = avatar == null ? AvatarProfile.defaults() : avatar;
    }
}
