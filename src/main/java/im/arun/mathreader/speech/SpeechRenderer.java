package im.arun.mathreader.speech;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.config.SpeechStyle;
import im.arun.mathreader.model.SemanticNode;
import im.arun.mathreader.render.BaseRenderer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a semantic tree as English speech text.
 *
 * <p>Each rule builds an ordered list of fragments that is joined with
 * single spaces after dropping empty ones. Verbosity is read from the
 * configuration once, when the renderer is created.
 *
 * <pre>
 * SpeechRenderer speech = new SpeechRenderer(config);
 * speech.render(parser.parse("\\frac{a^2}{b}"));
 * // "start fraction a to the power of 2 over b end fraction"
 * </pre>
 */
public class SpeechRenderer extends BaseRenderer {
    private final SpeechRuleSet rules;
    private final SpeechStyle verbosity;

    public SpeechRenderer() {
        this(new MathReaderConfig());
    }

    public SpeechRenderer(MathReaderConfig config) {
        this(config, new SpeechRuleSet());
    }

    public SpeechRenderer(MathReaderConfig config, SpeechRuleSet rules) {
        super(config);
        this.rules = rules;
        SpeechStyle style = this.config.getSpeech().getStyle();
        this.verbosity = style != null ? style : SpeechStyle.VERBOSE;
    }

    public SpeechStyle getVerbosity() {
        return verbosity;
    }

    @Override
    public String visitRoot(SemanticNode node) {
        return renderChildren(node);
    }

    @Override
    public String visitGroup(SemanticNode node) {
        return renderChildren(node);
    }

    @Override
    public String visitNumber(SemanticNode node) {
        return rules.getNumberName(node.getContent());
    }

    @Override
    public String visitIdentifier(SemanticNode node) {
        return rules.getIdentifierName(node.getContent());
    }

    @Override
    public String visitOperator(SemanticNode node) {
        return rules.getOperatorName(node.getContent());
    }

    @Override
    public String visitRelation(SemanticNode node) {
        return rules.getRelationName(node.getContent());
    }

    @Override
    public String visitFunction(SemanticNode node) {
        return node.getContent();
    }

    @Override
    public String visitText(SemanticNode node) {
        return node.getContent();
    }

    // [start] numerator over denominator [end]
    @Override
    public String visitFraction(SemanticNode node) {
        return join(List.of(
            phrase("fraction_start"),
            renderChild(node, 0),
            phrase("fraction_over"),
            renderChild(node, 1),
            phrase("fraction_end")));
    }

    @Override
    public String visitSuperscript(SemanticNode node) {
        return join(List.of(renderChild(node, 0), phrase("superscript"), renderChild(node, 1)));
    }

    @Override
    public String visitSubscript(SemanticNode node) {
        return join(List.of(renderChild(node, 0), phrase("subscript"), renderChild(node, 1)));
    }

    @Override
    public String visitSqrt(SemanticNode node) {
        return join(List.of(phrase("sqrt"), renderChild(node, 0), phrase("sqrt_end")));
    }

    // Index is spoken before the root phrase: "3 root of x"
    @Override
    public String visitNRoot(SemanticNode node) {
        return join(List.of(renderChild(node, 0), phrase("nroot"), renderChild(node, 1)));
    }

    @Override
    public String visitSum(SemanticNode node) {
        return phraseThenChildren("sum", node);
    }

    @Override
    public String visitIntegral(SemanticNode node) {
        return phraseThenChildren("integral", node);
    }

    @Override
    protected String renderDefault(SemanticNode node) {
        if (!node.getContent().isEmpty()) {
            return node.getContent();
        }
        return renderChildren(node);
    }

    private String phraseThenChildren(String key, SemanticNode node) {
        List<String> parts = new ArrayList<>();
        parts.add(phrase(key));
        for (SemanticNode child : node.getChildren()) {
            parts.add(render(child));
        }
        return join(parts);
    }

    private String renderChildren(SemanticNode node) {
        return join(node.getChildren().stream().map(this::render).collect(Collectors.toList()));
    }

    private String phrase(String key) {
        return rules.getPhrase(key, verbosity);
    }

    private static String join(List<String> parts) {
        return parts.stream()
            .filter(part -> part != null && !part.isEmpty())
            .collect(Collectors.joining(" "));
    }
}
