package im.arun.mathreader.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.config.SpeechStyle;
import im.arun.mathreader.model.NodeType;
import im.arun.mathreader.model.SemanticNode;
import im.arun.mathreader.navigation.MathNavigator;
import im.arun.mathreader.parser.MathParseException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MathReaderTest {

    private final MathReader reader = new MathReader();

    @Test
    void readsLatexAndMathmlAlike() {
        SemanticNode latex = reader.parse("\\frac{a}{b}");
        SemanticNode mathml = reader.parse("<math><mfrac><mi>a</mi><mi>b</mi></mfrac></math>");

        assertThat(reader.toSpeech(latex)).isEqualTo("start fraction a over b end fraction");
        assertThat(reader.toSpeech(mathml)).isEqualTo(reader.toSpeech(latex));
        assertThat(reader.toBraille(mathml)).isEqualTo(reader.toBraille(latex));
    }

    @Test
    void rendersExplicitNotationAndText() {
        SemanticNode tree = reader.parse("x^2");

        assertThat(reader.toBraille(tree, "ueb")).isEqualTo("⠭⠔⠼⠃");
        assertThat(reader.toSimpleText(tree)).isEqualTo("x^2");
    }

    @Test
    void setsVerbosityByName() {
        SemanticNode tree = reader.parse("\\frac{a}{b}");

        reader.setVerbosity("concise");

        assertThat(reader.getVerbosity()).isEqualTo(SpeechStyle.CONCISE);
        assertThat(reader.toSpeech(tree)).isEqualTo("a over b");
        assertThatThrownBy(() -> reader.setVerbosity("chatty"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void doesNotShareConfigWithCaller() {
        MathReaderConfig config = new MathReaderConfig();
        MathReader own = new MathReader(config);

        own.setVerbosity(SpeechStyle.SUPERBRIEF);

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
    }

    @Test
    void configReflectsVerbosityChange() {
        reader.setVerbosity(SpeechStyle.SUPERBRIEF);

        assertThat(reader.getConfig().getSpeech().getStyle()).isEqualTo(SpeechStyle.SUPERBRIEF);
    }

    @Test
    void parsesThroughRegisteredInputFormat() {
        reader.registerInputFormat("plain-number", input -> input.matches("#\\d+"),
                input -> new SemanticNode(NodeType.ROOT).addChild(new SemanticNode(NodeType.NUMBER, input.substring(1))));

        SemanticNode tree = reader.parse("#42");

        assertThat(reader.toSpeech(tree)).isEqualTo("42");
        assertThat(reader.toBraille(tree)).isEqualTo("⠼⠲⠆");
    }

    @Test
    void exposesStructureAndNavigator() {
        SemanticNode tree = reader.parse("a + b");

        Map<String, Object> structure = reader.getStructure(tree);
        MathNavigator navigator = reader.getNavigator(tree);

        assertThat(structure).containsEntry("type", "ROOT").containsEntry("node_id", "math-node");
        assertThat(navigator.enter()).isTrue();
        assertThat(navigator.getCurrent().getNodeType()).isEqualTo(NodeType.IDENTIFIER);
    }

    @Test
    void propagatesParseErrors() {
        assertThatThrownBy(() -> reader.parse("\\frac{a}{b"))
                .isInstanceOf(MathParseException.class);
    }
}
