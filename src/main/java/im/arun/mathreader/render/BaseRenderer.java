package im.arun.mathreader.render;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.model.NodeType;
import im.arun.mathreader.model.NodeVisitor;
import im.arun.mathreader.model.SemanticNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatch shared by every renderer: a registered {@link NodeRule} wins,
 * otherwise the node is routed to its visit method. Every visit method
 * here falls through to {@link #renderDefault}; subclasses override the
 * ones they handle.
 */
public abstract class BaseRenderer implements Renderer, NodeVisitor<String> {
    private static final Logger logger = LoggerFactory.getLogger(BaseRenderer.class);

    protected final MathReaderConfig config;
    private final Map<NodeType, NodeRule> customRules = new EnumMap<>(NodeType.class);

    protected BaseRenderer(MathReaderConfig config) {
        this.config = config != null ? config : new MathReaderConfig();
    }

    @Override
    public String render(SemanticNode node) {
        NodeRule rule = customRules.get(node.getNodeType());
        if (rule != null) {
            return rule.apply(node, this);
        }
        return node.accept(this);
    }

    /**
     * Replaces the built-in rule for {@code type} on this renderer.
     */
    public void registerRule(NodeType type, NodeRule rule) {
        customRules.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(rule, "rule"));
    }

    public MathReaderConfig getConfig() {
        return config;
    }

    /**
     * Used for every node type without a dedicated rule.
     */
    protected abstract String renderDefault(SemanticNode node);

    /**
     * Renders the child at {@code index}, or "" if the node is missing it.
     */
    protected String renderChild(SemanticNode node, int index) {
        return index < node.childCount() ? render(node.getChild(index)) : "";
    }

    protected String fallback(SemanticNode node) {
        logger.debug("{} has no rule for {}, using fallback", getClass().getSimpleName(), node.getNodeType());
        return renderDefault(node);
    }

    @Override
    public String visitRoot(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitGroup(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitNumber(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitIdentifier(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitFraction(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitSuperscript(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitSubscript(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitSqrt(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitNRoot(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitOperator(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitRelation(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitFunction(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitSum(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitProduct(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitIntegral(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitLimit(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitMatrix(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitMatrixRow(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitText(SemanticNode node) {
        return fallback(node);
    }

    @Override
    public String visitSpace(SemanticNode node) {
        return fallback(node);
    }
}
