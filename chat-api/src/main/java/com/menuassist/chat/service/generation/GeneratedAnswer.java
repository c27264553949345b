package com.menuassist.chat.service.generation;

/**
 * Result of a non-streaming generation. {@code cacheable} is false for fallback text and for
 * answers from providers whose output must not outlive the turn.
 */
public record GeneratedAnswer(String text, boolean fallback, boolean cacheable, ProviderFailure failure) {

    public static GeneratedAnswer success(String text) {
        return success(text, true);
    }

    public static GeneratedAnswer success(String text, boolean cacheable) {
        return new GeneratedAnswer(text, false, cacheable, null);
    }

    public static GeneratedAnswer fallback(String text, ProviderFailure failure) {
        return new GeneratedAnswer(text, true, false, failure);
    }
}
