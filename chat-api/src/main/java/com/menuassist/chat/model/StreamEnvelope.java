package com.menuassist.chat.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEnvelope(StreamEnvelopeType type, String content) {

    public static StreamEnvelope token(String content) {
        return new StreamEnvelope(StreamEnvelopeType.TOKEN, content);
    }

    public static StreamEnvelope done() {
        return new StreamEnvelope(StreamEnvelopeType.DONE, null);
    }

    public static StreamEnvelope error(String content) {
        return new StreamEnvelope(StreamEnvelopeType.ERROR, content);
    }
}
