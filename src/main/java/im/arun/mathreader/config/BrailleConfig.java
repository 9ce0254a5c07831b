package im.arun.mathreader.config;

import lombok.Data;

@Data
public class BrailleConfig {
    private BrailleNotation notation = BrailleNotation.NEMETH;
    private boolean includeIndicators = true;
    private UnsupportedFallback unsupportedFallback = UnsupportedFallback.DESCRIBE;
}
