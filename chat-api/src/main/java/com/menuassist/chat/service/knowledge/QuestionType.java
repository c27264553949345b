package com.menuassist.chat.service.knowledge;

public enum QuestionType {
    DESCRIPTION,
    INGREDIENTS,
    ALLERGENS,
    PRICE,
    PREPARATION
}
