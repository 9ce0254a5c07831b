package im.arun.mathreader.config;

import lombok.Data;

@Data
public class MathReaderConfig {
    private SpeechConfig speech = new SpeechConfig();
    private BrailleConfig braille = new BrailleConfig();
    private int maxNestingDepth = 200;

    /**
     * Deep copy, so callers can tweak a config without touching the original.
     */
    public MathReaderConfig copy() {
        MathReaderConfig copy = new MathReaderConfig();
        copy.getSpeech().setStyle(speech.getStyle());
        copy.getSpeech().setLanguage(speech.getLanguage());
        copy.getSpeech().setRate(speech.getRate());
        copy.getSpeech().setAnnounceStructure(speech.isAnnounceStructure());
        copy.getBraille().setNotation(braille.getNotation());
        copy.getBraille().setIncludeIndicators(braille.isIncludeIndicators());
        copy.getBraille().setUnsupportedFallback(braille.getUnsupportedFallback());
        copy.setMaxNestingDepth(maxNestingDepth);
        return copy;
    }
}
