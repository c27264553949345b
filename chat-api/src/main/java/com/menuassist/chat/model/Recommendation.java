package com.menuassist.chat.model;

import java.math.BigDecimal;

public record Recommendation(String itemId, String name, BigDecimal price) {
}
