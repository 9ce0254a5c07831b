package im.arun.mathreader.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.tuple;

import im.arun.mathreader.model.NodeType;
import im.arun.mathreader.model.SemanticNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class LatexParserTest {

    private final LatexParser parser = new LatexParser(200);

    @Test
    void parsesFractionWithRoleGroups() {
        SemanticNode root = parser.parse("\\frac{a}{b}");

        assertThat(root.getNodeType()).isEqualTo(NodeType.ROOT);
        SemanticNode fraction = root.getChild(0);
        assertThat(fraction.getNodeType()).isEqualTo(NodeType.FRACTION);
        assertThat(fraction.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getRole)
                .containsExactly(tuple(NodeType.GROUP, "numerator"), tuple(NodeType.GROUP, "denominator"));
        assertThat(fraction.getChild(0).getChild(0).getContent()).isEqualTo("a");
        assertThat(fraction.getChild(1).getChild(0).getContent()).isEqualTo("b");
    }

    @Test
    void superscriptTakesPreviousSiblingAsBase() {
        SemanticNode root = parser.parse("x^2 + 1");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType)
                .containsExactly(NodeType.SUPERSCRIPT, NodeType.OPERATOR, NodeType.NUMBER);
        SemanticNode superscript = root.getChild(0);
        assertThat(superscript.getChild(0).getContent()).isEqualTo("x");
        assertThat(superscript.getChild(1).getRole()).isEqualTo("exponent");
        assertThat(superscript.getChild(1).getChild(0).getContent()).isEqualTo("2");
    }

    @Test
    void scriptPayloadTakesOnlyOneCharacterWithoutBraces() {
        SemanticNode root = parser.parse("x^23");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(tuple(NodeType.SUPERSCRIPT, ""), tuple(NodeType.NUMBER, "3"));
        assertThat(root.getChild(0).getChild(1).getChild(0).getContent()).isEqualTo("2");
    }

    @Test
    void scriptPayloadCanBeCommand() {
        SemanticNode root = parser.parse("e^\\alpha");

        SemanticNode exponent = root.getChild(0).getChild(1);
        assertThat(exponent.getChild(0).getNodeType()).isEqualTo(NodeType.IDENTIFIER);
        assertThat(exponent.getChild(0).getContent()).isEqualTo("α");
    }

    @Test
    void parsesBracedSubscript() {
        SemanticNode root = parser.parse("a_{i+1}");

        SemanticNode subscript = root.getChild(0);
        assertThat(subscript.getNodeType()).isEqualTo(NodeType.SUBSCRIPT);
        assertThat(subscript.getChild(1).getRole()).isEqualTo("subscript");
        assertThat(subscript.getChild(1).getChildren())
                .extracting(SemanticNode::getContent)
                .containsExactly("i", "+", "1");
    }

    @Test
    void stripsDollarDelimitersAndRecordsSource() {
        SemanticNode root = parser.parse("  $x + 1$ ");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.IDENTIFIER, "x"),
                        tuple(NodeType.OPERATOR, "+"),
                        tuple(NodeType.NUMBER, "1"));
        assertThat(root.getMetadata()).containsEntry(SemanticNode.SOURCE, "x + 1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "$$"})
    void emptyInputYieldsEmptyRoot(String input) {
        SemanticNode root = parser.parse(input);

        assertThat(root.getNodeType()).isEqualTo(NodeType.ROOT);
        assertThat(root.childCount()).isZero();
    }

    @ParameterizedTest
    @CsvSource({
        "3.14, 3.14",
        ".5, .5",
        "42, 42"
    })
    void readsNumbers(String input, String expected) {
        SemanticNode root = parser.parse(input);

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(tuple(NodeType.NUMBER, expected));
    }

    @Test
    void mapsOperatorsAndRelations() {
        SemanticNode root = parser.parse("a*b \\leq c \\neq d \\pm e");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.IDENTIFIER, "a"),
                        tuple(NodeType.OPERATOR, "×"),
                        tuple(NodeType.IDENTIFIER, "b"),
                        tuple(NodeType.RELATION, "≤"),
                        tuple(NodeType.IDENTIFIER, "c"),
                        tuple(NodeType.RELATION, "≠"),
                        tuple(NodeType.IDENTIFIER, "d"),
                        tuple(NodeType.OPERATOR, "±"),
                        tuple(NodeType.IDENTIFIER, "e"));
    }

    @Test
    void parsesLargeOperatorsFunctionsAndGreek() {
        SemanticNode root = parser.parse("\\sum \\int \\prod \\sin \\Gamma \\infty");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.SUM, "∑"),
                        tuple(NodeType.INTEGRAL, "∫"),
                        tuple(NodeType.PRODUCT, "∏"),
                        tuple(NodeType.FUNCTION, "sin"),
                        tuple(NodeType.IDENTIFIER, "Γ"),
                        tuple(NodeType.IDENTIFIER, "∞"));
    }

    @Test
    void parsesSquareAndIndexedRoots() {
        SemanticNode sqrt = parser.parse("\\sqrt{x}").getChild(0);
        SemanticNode cube = parser.parse("\\sqrt[3]{x}").getChild(0);
        SemanticNode blankIndex = parser.parse("\\sqrt[ ]{x}").getChild(0);

        assertThat(sqrt.getNodeType()).isEqualTo(NodeType.SQRT);
        assertThat(sqrt.getChild(0).getRole()).isEqualTo("radicand");
        assertThat(cube.getNodeType()).isEqualTo(NodeType.NROOT);
        assertThat(cube.getChildren())
                .extracting(SemanticNode::getRole)
                .containsExactly("index", "radicand");
        assertThat(cube.getChild(0).getChild(0).getContent()).isEqualTo("3");
        assertThat(blankIndex.getNodeType()).isEqualTo(NodeType.SQRT);
    }

    @Test
    void keepsUnknownCommandAsText() {
        SemanticNode root = parser.parse("\\foo x");

        SemanticNode text = root.getChild(0);
        assertThat(text.getNodeType()).isEqualTo(NodeType.TEXT);
        assertThat(text.getContent()).isEqualTo("\\foo");
        assertThat(text.getMetadata()).containsEntry(SemanticNode.UNKNOWN_COMMAND, true);
        assertThat(root.getChild(1).getContent()).isEqualTo("x");
    }

    @Test
    void handlesControlSymbols() {
        SemanticNode root = parser.parse("\\{a\\,b\\}");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.OPERATOR, "{"),
                        tuple(NodeType.IDENTIFIER, "a"),
                        tuple(NodeType.IDENTIFIER, "b"),
                        tuple(NodeType.OPERATOR, "}"));
    }

    @Test
    void keepsPlainDelimitersAsOperators() {
        SemanticNode root = parser.parse("(a)");

        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.OPERATOR, "("),
                        tuple(NodeType.IDENTIFIER, "a"),
                        tuple(NodeType.OPERATOR, ")"));
    }

    @Test
    void reportsUnclosedBraceWithContext() {
        MathParseException error = catchThrowableOfType(
                () -> parser.parse("\\frac{a}{b"), MathParseException.class);

        assertThat(error.getReason()).isEqualTo("Unclosed brace");
        assertThat(error.getPosition()).isNotNull();
        assertThat(error.getSource()).isEqualTo("\\frac{a}{b");
        assertThat(error.getMessage()).contains("Context:").contains("^");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "^2|Superscript without base",
        "_i|Subscript without base",
        "\\frac a|Expected { after \\frac",
        "\\frac{a} b|Expected { for denominator",
        "\\sqrt x|Expected { after \\sqrt",
        "\\sqrt[3{x}|Unclosed [ in sqrt",
        "{x|Unclosed brace"
    })
    void rejectsMalformedInput(String input, String reason) {
        MathParseException error = catchThrowableOfType(() -> parser.parse(input), MathParseException.class);

        assertThat(error).isNotNull();
        assertThat(error.getReason()).isEqualTo(reason);
    }

    @Test
    void limitsNestingDepth() {
        LatexParser shallow = new LatexParser(3);

        assertThat(shallow.parse("{{{x}}}").childCount()).isEqualTo(1);
        assertThatThrownBy(() -> shallow.parse("{{{{{x}}}}}"))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("Maximum nesting depth exceeded");
    }

    @Test
    void countsChainedScriptsTowardNestingDepth() {
        LatexParser shallow = new LatexParser(5);

        assertThat(shallow.parse("x^1^1").getChild(0).getNodeType()).isEqualTo(NodeType.SUPERSCRIPT);
        assertThatThrownBy(() -> shallow.parse("x^1^1^1^1^1^1"))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("Maximum nesting depth exceeded");
    }

    @ParameterizedTest
    @ValueSource(strings = {"^1", "_1", "^{1}", "_\\alpha"})
    void rejectsLongScriptChainsWithDefaultLimit(String link) {
        String chain = "x" + link.repeat(50000);

        assertThatThrownBy(() -> parser.parse(chain))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("Maximum nesting depth exceeded");
    }

    @Test
    void chainedScriptsNestLeftToRight() {
        SemanticNode outer = parser.parse("x_i^2").getChild(0);

        assertThat(outer.getNodeType()).isEqualTo(NodeType.SUPERSCRIPT);
        assertThat(outer.getChild(0).getNodeType()).isEqualTo(NodeType.SUBSCRIPT);
        assertThat(outer.getChild(1).getChild(0).getContent()).isEqualTo("2");
    }

    @Test
    void keepsSupplementaryCharactersWhole() {
        SemanticNode root = parser.parse("x^\uD835\uDC65 + \uD835\uDC66");

        SemanticNode exponent = root.getChild(0).getChild(1);
        assertThat(exponent.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(tuple(NodeType.IDENTIFIER, "\uD835\uDC65"));
        assertThat(root.getChildren())
                .extracting(SemanticNode::getNodeType, SemanticNode::getContent)
                .containsExactly(
                        tuple(NodeType.SUPERSCRIPT, ""),
                        tuple(NodeType.OPERATOR, "+"),
                        tuple(NodeType.IDENTIFIER, "\uD835\uDC66"));
    }

    @Test
    void survivesPathologicalNestingWithDefaultLimit() {
        String deep = "{".repeat(5000) + "x" + "}".repeat(5000);

        assertThatThrownBy(() -> parser.parse(deep))
                .isInstanceOf(MathParseException.class)
                .hasMessageStartingWith("Maximum nesting depth exceeded");
    }
}
