package com.menuassist.chat.service.generation;

/**
 * One element of a generation stream. A stream is zero or more {@link Type#TOKEN} events followed
 * by exactly one {@link Type#DONE}.
 * <p>
 * The DONE event carries the full answer. When {@code fallback} is set that text is the fallback
 * message; {@code interrupted} additionally tells that provider tokens had already been emitted
 * before the failure, so the streamed tokens do not add up to the DONE text. {@code cacheable}
 * is never set on a fallback.
 */
public record GenerationEvent(Type type, String text, boolean fallback, boolean interrupted, boolean cacheable) {

    public enum Type {
        TOKEN,
        DONE
    }

    public static GenerationEvent token(String text) {
        return new GenerationEvent(Type.TOKEN, text, false, false, false);
    }

    public static GenerationEvent done(String text) {
        return done(text, true);
    }

    public static GenerationEvent done(String text, boolean cacheable) {
        return new GenerationEvent(Type.DONE, text, false, false, cacheable);
    }

    public static GenerationEvent fallbackDone(String text, boolean interrupted) {
        return new GenerationEvent(Type.DONE, text, true, interrupted, false);
    }

    public boolean isToken() {
        return type == Type.TOKEN;
    }
}
