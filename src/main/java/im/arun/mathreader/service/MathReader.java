package im.arun.mathreader.service;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.config.SpeechStyle;
import im.arun.mathreader.model.SemanticNode;
import im.arun.mathreader.navigation.MathNavigator;
import im.arun.mathreader.parser.MathParser;
import im.arun.mathreader.render.MathRenderer;
import im.arun.mathreader.util.TreeSerializer;

import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One-stop entry point: parse an expression once, then ask for speech,
 * Braille, a text form, a navigator or the serialized structure.
 *
 * <pre>
 * MathReader reader = new MathReader();
 * SemanticNode tree = reader.parse("x^2 + 1");
 * reader.toSpeech(tree);   // "x to the power of 2 plus 1"
 * reader.toBraille(tree);  // Nemeth by default
 * </pre>
 */
public class MathReader {
    private final MathParser parser;
    private final MathRenderer renderer;

    public MathReader() {
        this(new MathReaderConfig());
    }

    public MathReader(MathReaderConfig config) {
        MathReaderConfig own = config != null ? config.copy() : new MathReaderConfig();
        this.parser = new MathParser(own);
        this.renderer = new MathRenderer(own);
    }

    /**
     * @throws im.arun.mathreader.parser.MathParseException if the input is malformed
     */
    public SemanticNode parse(String expression) {
        return parser.parse(expression);
    }

    /**
     * Adds an input format that is tried before MathML and LaTeX detection.
     */
    public void registerInputFormat(String name, Predicate<String> canParse,
                                    Function<String, SemanticNode> parser) {
        this.parser.registerInputFormat(name, canParse, parser);
    }

    public String toSpeech(SemanticNode tree) {
        return renderer.toSpeech(tree);
    }

    public String toBraille(SemanticNode tree) {
        return renderer.toBraille(tree);
    }

    public String toBraille(SemanticNode tree, String notation) {
        return renderer.toBraille(tree, notation);
    }

    public String toSimpleText(SemanticNode tree) {
        return renderer.toSimpleText(tree);
    }

    public MathNavigator getNavigator(SemanticNode tree) {
        return new MathNavigator(tree);
    }

    public Map<String, Object> getStructure(SemanticNode tree) {
        return TreeSerializer.toMap(tree);
    }

    public void setVerbosity(SpeechStyle style) {
        renderer.setVerbosity(style);
    }

    /**
     * @throws IllegalArgumentException for an unknown style name
     */
    public void setVerbosity(String style) {
        setVerbosity(SpeechStyle.fromValue(style));
    }

    public SpeechStyle getVerbosity() {
        return renderer.getSpeechRenderer().getVerbosity();
    }

    public MathRenderer getRenderer() {
        return renderer;
    }

    /**
     * The configuration rendering currently uses, verbosity changes included.
     */
    public MathReaderConfig getConfig() {
        return renderer.getConfig();
    }
}
