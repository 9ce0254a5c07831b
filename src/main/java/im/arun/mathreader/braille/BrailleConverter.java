package im.arun.mathreader.braille;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.config.UnsupportedFallback;
import im.arun.mathreader.model.SemanticNode;
import im.arun.mathreader.render.BaseRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Base for Braille code renderers. Output is Unicode Braille cells, built by
 * concatenating the renderings of child nodes with no separator.
 *
 * <p>Converters hold no per-render state: the same tree and configuration
 * always produce the same cells.
 */
public abstract class BrailleConverter extends BaseRenderer {
    private static final Logger logger = LoggerFactory.getLogger(BrailleConverter.class);

    public static final String BRAILLE_SPACE = "⠀";

    protected BrailleConverter(MathReaderConfig config) {
        super(config);
        UnsupportedFallback fallback = this.config.getBraille().getUnsupportedFallback();
        if (fallback != null && fallback.isReserved()) {
            logger.info("Unsupported-construct policy '{}' is reserved, {} falls back to describe",
                fallback.value(), notationName());
        }
    }

    /**
     * Lower-case name this converter is registered under.
     */
    public abstract String notationName();

    protected abstract Map<Character, String> letters();

    protected abstract Map<Character, String> digits();

    @Override
    public String visitRoot(SemanticNode node) {
        return renderChildren(node);
    }

    @Override
    public String visitGroup(SemanticNode node) {
        return renderChildren(node);
    }

    @Override
    public String visitFunction(SemanticNode node) {
        return transliterate(node.getContent().toLowerCase(Locale.ROOT));
    }

    /**
     * Raw content goes through the letter and digit tables; anything else
     * passes through unchanged.
     */
    @Override
    protected String renderDefault(SemanticNode node) {
        if (!node.getContent().isEmpty()) {
            return renderText(node.getContent());
        }
        return renderChildren(node);
    }

    protected abstract String renderText(String text);

    protected boolean includeIndicators() {
        return config.getBraille().isIncludeIndicators();
    }

    protected String renderChildren(SemanticNode node) {
        StringBuilder sb = new StringBuilder();
        for (SemanticNode child : node.getChildren()) {
            sb.append(render(child));
        }
        return sb.toString();
    }

    /**
     * Maps letters and digits cell by cell, spaces to the Braille space.
     */
    protected String transliterate(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (letters().containsKey(c)) {
                sb.append(letters().get(c));
            } else if (digits().containsKey(c)) {
                sb.append(digits().get(c));
            } else if (c == ' ') {
                sb.append(BRAILLE_SPACE);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    protected String mapDigits(String number, String decimalPoint) {
        StringBuilder sb = new StringBuilder();
        for (char c : number.toCharArray()) {
            if (digits().containsKey(c)) {
                sb.append(digits().get(c));
            } else if (c == '.') {
                sb.append(decimalPoint);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
