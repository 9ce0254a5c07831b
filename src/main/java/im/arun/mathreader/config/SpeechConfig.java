package im.arun.mathreader.config;

import lombok.Data;

/**
 * Speech output settings. Only {@code style} affects rendering; the rest is
 * passed through to whatever synthesizes the text.
 */
@Data
public class SpeechConfig {
    private SpeechStyle style = SpeechStyle.VERBOSE;
    private String language = "en";
    private double rate = 1.0;
    private boolean announceStructure = true;
}
