package im.arun.mathreader.render;

import im.arun.mathreader.model.SemanticNode;

/**
 * A rendering rule for one node type, registered on a renderer to replace
 * its built-in handling. {@code renderer} renders children recursively.
 */
@FunctionalInterface
public interface NodeRule {

    String apply(SemanticNode node, Renderer renderer);
}
