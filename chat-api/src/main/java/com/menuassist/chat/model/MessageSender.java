package com.menuassist.chat.model;

public enum MessageSender {
    CUSTOMER("user"),
    ASSISTANT("assistant");

    private final String promptRole;

    MessageSender(String promptRole) {
        this.promptRole = promptRole;
    }

    public String promptRole() {
        return promptRole;
    }
}
