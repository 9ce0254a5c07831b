package im.arun.mathreader.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import im.arun.mathreader.model.NodeType;
import im.arun.mathreader.model.SemanticNode;
import org.junit.jupiter.api.Test;
import org.xml.sax.SAXException;

class MathmlParserTest {

    private final MathmlParser parser = new MathmlParser(200);

    @Test
    void parsesFraction() {
        SemanticNode root = parser.parse("<math><mfrac><mi>a</mi><mi>b</mi></mfrac></math>");

        SemanticNode fraction = root.getChild(0);
        assertThat(root.childCount()).isEqualTo(1);
        assertThat(fraction.getNodeType()).isEqualTo(NodeType.FRACTION);
        assertThat(fraction.getChildren())
                .extracting(SemanticNode::getRole)
                .containsExactly("numerator", "denominator");
        assertThat(fraction.getChild(1).getChild(0).getContent()).isEqualTo("b");
    }

    @Test
    void wrapsScriptBaseInRoleGroup() {
        SemanticNode root = parser.parse("<math><msup><mi>x</mi><mn>2</mn></msup></math>");

        SemanticNode superscript = root.getChild(0);
        assertThat(superscript.getNodeType()).isEqualTo(NodeType.SUPERSCRIPT);
        assertThat(superscript.getChildren())
                .extracting(SemanticNode::getRole)
                .containsExactly("base", "exponent");
        assertThat(superscript.getChild(0).getChild(0).getContent()).isEqualTo("x");
    }

    @Test
    void classifiesOperatorsAndRelations() {
        SemanticNode root = parser.parse(
                "<math><mrow><mi> x </mi><mo>+</mo><mn>1</mn><mo>≤</mo><mtext>done</mtext></mrow></math>");

        SemanticNode row = root.getChild(0);
        assertThat(row.getNodeType()).isEqualTo(NodeType.GROUP);
        assertThat(row.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.IDENTIFIER, "x"),
                        tuple(NodeType.OPERATOR, "+"),
                        tuple(NodeType.NUMBER, "1"),
                        tuple(NodeType.RELATION, "≤"),
                        tuple(NodeType.TEXT, "done"));
    }

    @Test
    void sqrtChildrenFormRadicand() {
        SemanticNode root = parser.parse("<math><msqrt><mi>x</mi><mo>+</mo><mn>1</mn></msqrt></math>");

        SemanticNode sqrt = root.getChild(0);
        assertThat(sqrt.getNodeType()).isEqualTo(NodeType.SQRT);
        assertThat(sqrt.getChild(0).getRole()).isEqualTo("radicand");
        assertThat(sqrt.getChild(0).childCount()).isEqualTo(3);
    }

    @Test
    void stripsNamespaceDeclarations() {
        SemanticNode plain = parser.parse(
                "<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><mi>x</mi></math>");
        SemanticNode prefixed = parser.parse(
                "<m:math xmlns:m=\"http://www.w3.org/1998/Math/MathML\"><m:mi>y</m:mi></m:math>");

        assertThat(plain.getChild(0).getContent()).isEqualTo("x");
        assertThat(prefixed.getChild(0).getNodeType()).isEqualTo(NodeType.IDENTIFIER);
        assertThat(prefixed.getChild(0).getContent()).isEqualTo("y");
        assertThat(plain.getMetadata().get(SemanticNode.SOURCE).toString()).doesNotContain("xmlns");
    }

    @Test
    void unknownElementsAreTransparent() {
        SemanticNode root = parser.parse("<math><mstyle><mi>x</mi></mstyle></math>");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(tuple(NodeType.IDENTIFIER, "x"));
    }

    @Test
    void enforcesArity() {
        assertThatThrownBy(() -> parser.parse("<math><mfrac><mi>a</mi></mfrac></math>"))
                .isInstanceOf(MathParseException.class)
                .hasMessage("mfrac requires exactly 2 child elements, found 1");
        assertThatThrownBy(() -> parser.parse("<math><msup><mi>a</mi><mi>b</mi><mi>c</mi></msup></math>"))
                .isInstanceOf(MathParseException.class)
                .hasMessage("msup requires exactly 2 child elements, found 3");
        assertThatThrownBy(() -> parser.parse("<math><msqrt></msqrt></math>"))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("msqrt requires at least 1 child element");
    }

    @Test
    void wrapsMalformedXml() {
        assertThatThrownBy(() -> parser.parse("<math><mi>x</math>"))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("Invalid MathML")
                .hasCauseInstanceOf(SAXException.class);
    }

    @Test
    void rejectsDoctype() {
        assertThatThrownBy(() -> parser.parse("<!DOCTYPE math [<!ENTITY x \"y\">]><math><mi>&x;</mi></math>"))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("Invalid MathML");
    }

    @Test
    void limitsNestingDepth() {
        MathmlParser shallow = new MathmlParser(2);

        assertThatThrownBy(() -> shallow.parse("<math><mrow><mrow><mrow><mi>x</mi></mrow></mrow></mrow></math>"))
                .isInstanceOf(MathParseException.class)
                .hasMessage("Maximum nesting depth exceeded");
    }
}
