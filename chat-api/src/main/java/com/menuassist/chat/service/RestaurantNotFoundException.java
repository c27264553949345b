package com.menuassist.chat.service;

public class RestaurantNotFoundException extends RuntimeException {

    private final String restaurantId;

    public RestaurantNotFoundException(String restaurantId) {
        super("Restaurant " + restaurantId + " was not found");
        this.restaurantId = restaurantId;
    }

    public String getRestaurantId() {
        return restaurantId;
    }
}
