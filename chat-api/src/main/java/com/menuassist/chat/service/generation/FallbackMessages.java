package com.menuassist.chat.service.generation;

import com.menuassist.chat.service.menu.RestaurantProfile;

public final class FallbackMessages {

    private FallbackMessages() {
    }

    /**
     * Static reply used when generation fails. Built from identity fields only, never from
     * provider output or error text.
     */
    public static String forRestaurant(RestaurantProfile restaurant) {
        return "Hi! I'm " + restaurant.avatar().name() + " and I work here at " + restaurant.name()
                + ". What can I help you with today?";
    }
}
