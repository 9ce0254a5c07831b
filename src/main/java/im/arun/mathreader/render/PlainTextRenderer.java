package im.arun.mathreader.render;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.model.SemanticNode;

import java.util.stream.Collectors;

/**
 * Linear text form for debugging and display, e.g. {@code (a)/(b)} or
 * {@code x^2}.
 */
public class PlainTextRenderer extends BaseRenderer {

    public PlainTextRenderer() {
        this(new MathReaderConfig());
    }

    public PlainTextRenderer(MathReaderConfig config) {
        super(config);
    }

    @Override
    public String visitRoot(SemanticNode node) {
        return renderChildren(node);
    }

    @Override
    public String visitGroup(SemanticNode node) {
        String content = renderChildren(node);
        return node.childCount() > 1 ? "(" + content + ")" : content;
    }

    @Override
    public String visitFraction(SemanticNode node) {
        return "(" + renderChild(node, 0) + ")/(" + renderChild(node, 1) + ")";
    }

    @Override
    public String visitSuperscript(SemanticNode node) {
        return renderChild(node, 0) + "^" + renderChild(node, 1);
    }

    @Override
    public String visitSubscript(SemanticNode node) {
        return renderChild(node, 0) + "_" + renderChild(node, 1);
    }

    @Override
    public String visitSqrt(SemanticNode node) {
        return "√(" + renderChild(node, 0) + ")";
    }

    @Override
    public String visitNumber(SemanticNode node) {
        return node.getContent();
    }

    @Override
    public String visitIdentifier(SemanticNode node) {
        return node.getContent();
    }

    @Override
    public String visitOperator(SemanticNode node) {
        return node.getContent();
    }

    @Override
    public String visitRelation(SemanticNode node) {
        return node.getContent();
    }

    @Override
    public String visitFunction(SemanticNode node) {
        return node.getContent();
    }

    @Override
    public String visitText(SemanticNode node) {
        return node.getContent();
    }

    @Override
    protected String renderDefault(SemanticNode node) {
        return renderChildren(node);
    }

    private String renderChildren(SemanticNode node) {
        return node.getChildren().stream().map(this::render).collect(Collectors.joining(" "));
    }
}
