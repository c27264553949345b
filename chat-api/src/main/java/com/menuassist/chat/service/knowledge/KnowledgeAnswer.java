package com.menuassist.chat.service.knowledge;

import com.menuassist.chat.service.menu.MenuItemKnowledge;

public record KnowledgeAnswer(QuestionType type, MenuItemKnowledge item, String text, boolean fromCache) {
}
