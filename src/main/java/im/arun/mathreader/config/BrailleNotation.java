package im.arun.mathreader.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Built-in Braille mathematics codes.
 */
public enum BrailleNotation {
    NEMETH,
    UEB;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static BrailleNotation fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Braille notation must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown Braille notation: " + value, e);
        }
    }
}
