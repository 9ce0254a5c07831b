package im.arun.mathreader.model;

/**
 * One handler per {@link NodeType}. Adding a node type breaks every visitor
 * until it gets a handler, so no renderer can silently miss a construct.
 *
 * @param <R> result of visiting a node
 */
public interface NodeVisitor<R> {

    R visitRoot(SemanticNode node);

    R visitGroup(SemanticNode node);

    R visitNumber(SemanticNode node);

    R visitIdentifier(SemanticNode node);

    R visitFraction(SemanticNode node);

    R visitSuperscript(SemanticNode node);

    R visitSubscript(SemanticNode node);

    R visitSqrt(SemanticNode node);

    R visitNRoot(SemanticNode node);

    R visitOperator(SemanticNode node);

    R visitRelation(SemanticNode node);

    R visitFunction(SemanticNode node);

    R visitSum(SemanticNode node);

    R visitProduct(SemanticNode node);

    R visitIntegral(SemanticNode node);

    R visitLimit(SemanticNode node);

    R visitMatrix(SemanticNode node);

    R visitMatrixRow(SemanticNode node);

    R visitText(SemanticNode node);

    R visitSpace(SemanticNode node);
}
