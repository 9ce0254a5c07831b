package im.arun.mathreader.render;

import im.arun.mathreader.model.SemanticNode;

/**
 * Turns a semantic tree into one output modality. Implementations never
 * throw for node shapes they do not recognise.
 */
public interface Renderer {

    String render(SemanticNode node);
}
