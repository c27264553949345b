package com.menuassist.chat.service;

public class ConversationNotFoundException extends RuntimeException {

    public ConversationNotFoundException(String restaurantId, String conversationId) {
        super("Conversation " + conversationId + " was not found for restaurant " + restaurantId);
    }
}
