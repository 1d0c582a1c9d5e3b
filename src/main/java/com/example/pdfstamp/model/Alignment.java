package com.example.pdfstamp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Horizontal alignment of a static field relative to its x coordinate.
 */
public enum Alignment {
    LEFT,
    CENTER;

    @JsonCreator
    public static Alignment fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LEFT;
        }
        // anything other than "center" is drawn left aligned
        return "center".equals(value.trim().toLowerCase(Locale.ROOT)) ? CENTER : LEFT;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
