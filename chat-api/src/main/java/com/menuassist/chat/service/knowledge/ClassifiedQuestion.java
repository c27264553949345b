package com.menuassist.chat.service.knowledge;

public record ClassifiedQuestion(QuestionType type, String candidateItemName) {
}
