package im.arun.mathreader.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Speech verbosity: full structural announcements, a shorter form, or a
 * minimal form for quick scanning.
 */
public enum SpeechStyle {
    VERBOSE,
    CONCISE,
    SUPERBRIEF;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SpeechStyle fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Speech style must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown speech style: " + value, e);
        }
    }
}
