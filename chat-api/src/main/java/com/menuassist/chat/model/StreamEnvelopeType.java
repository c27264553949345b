package com.menuassist.chat.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StreamEnvelopeType {
    TOKEN,
    DONE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StreamEnvelopeType fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
