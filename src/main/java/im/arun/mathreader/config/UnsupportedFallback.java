package im.arun.mathreader.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a Braille converter does with a construct it has no rule for.
 * Only {@link #DESCRIBE} is enforced; {@link #WARN} and {@link #ERROR} are
 * reserved and currently render like {@code DESCRIBE}.
 */
public enum UnsupportedFallback {
    DESCRIBE,
    WARN,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isReserved() {
        return this != DESCRIBE;
    }

    @JsonCreator
    public static UnsupportedFallback fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Unsupported fallback must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unsupported fallback: " + value, e);
        }
    }
}
