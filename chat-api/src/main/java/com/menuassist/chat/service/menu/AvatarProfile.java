package com.menuassist.chat.service.menu;

public record AvatarProfile(
        String name,
        String personality,
        String tone,
        String greeting,
        String specialInstructions
) {

    public static final String DEFAULT_NAME = "Assistant";

    public AvatarProfile {
        name = name == null || name.isBlank() ? DEFAULT_NAME : name.trim();
    }

    public static AvatarProfile defaults() {
        return new AvatarProfile(DEFAULT_NAME, "friendly_knowledgeable", "warm", null, null);
    }
}
