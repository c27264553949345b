package com.menuassist.chat.service.conversation;

public record RecordedTurn(String conversationId, String customerMessageId, String assistantMessageId) {
}
