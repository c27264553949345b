package com.menuassist.chat.service;

import java.util.Locale;

/**
 * Which step of the response ladder produced an answer, cheapest first.
 */
public enum ResponseTier {
    INSTANT,
    KNOWLEDGE,
    SEMANTIC,
    GENERATED,
    FALLBACK;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
