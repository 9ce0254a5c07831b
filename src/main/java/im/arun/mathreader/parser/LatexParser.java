package im.arun.mathreader.parser;

import im.arun.mathreader.model.NodeType;
import im.arun.mathreader.model.SemanticNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Single left-to-right scan over a LaTeX subset. There is no precedence
 * grammar: each construct is recognised by lookahead and emits its node
 * directly into the current parent.
 *
 * <p>Instances are cheap and stateless between calls.
 */
public class LatexParser {
    private static final Logger logger = LoggerFactory.getLogger(LatexParser.class);

    static final Map<String, String> GREEK_LETTERS = Map.ofEntries(
        entry("alpha", "α"), entry("beta", "β"), entry("gamma", "γ"), entry("delta", "δ"),
        entry("epsilon", "ε"), entry("zeta", "ζ"), entry("eta", "η"), entry("theta", "θ"),
        entry("iota", "ι"), entry("kappa", "κ"), entry("lambda", "λ"), entry("mu", "μ"),
        entry("nu", "ν"), entry("xi", "ξ"), entry("pi", "π"), entry("rho", "ρ"),
        entry("sigma", "σ"), entry("tau", "τ"), entry("upsilon", "υ"), entry("phi", "φ"),
        entry("chi", "χ"), entry("psi", "ψ"), entry("omega", "ω"),
        entry("Alpha", "Α"), entry("Beta", "Β"), entry("Gamma", "Γ"), entry("Delta", "Δ"),
        entry("Theta", "Θ"), entry("Lambda", "Λ"), entry("Xi", "Ξ"), entry("Pi", "Π"),
        entry("Sigma", "Σ"), entry("Phi", "Φ"), entry("Psi", "Ψ"), entry("Omega", "Ω")
    );

    static final Map<String, String> OPERATORS = Map.ofEntries(
        entry("+", "+"), entry("-", "-"), entry("*", "×"), entry("/", "÷"),
        entry("\\times", "×"), entry("\\cdot", "·"), entry("\\div", "÷"),
        entry("\\pm", "±"), entry("\\mp", "∓")
    );

    static final Map<String, String> RELATIONS = Map.ofEntries(
        entry("=", "="), entry("<", "<"), entry(">", ">"),
        entry("\\leq", "≤"), entry("\\geq", "≥"), entry("\\neq", "≠"),
        entry("\\approx", "≈"), entry("\\equiv", "≡"),
        entry("\\le", "≤"), entry("\\ge", "≥"), entry("\\ne", "≠")
    );

    static final Set<String> FUNCTIONS = Set.of("sin", "cos", "tan", "log", "ln", "exp", "lim");

    private static final String DELIMITERS = "()[]{}";

    private final int maxNestingDepth;

    public LatexParser(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a LaTeX expression, with or without surrounding {@code $}
     * delimiters. An empty input yields a Root without children.
     */
    public SemanticNode parse(String latex) {
        String cleaned = stripDelimiters(latex);
        SemanticNode root = new SemanticNode(NodeType.ROOT, "", Map.of(SemanticNode.SOURCE, cleaned));
        new Scan(cleaned).tokens(0, cleaned.length(), root, 0);
        logger.debug("Parsed LaTeX into {} top-level nodes", root.childCount());
        return root;
    }

    private static String stripDelimiters(String latex) {
        String s = latex == null ? "" : latex.strip();
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '$') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '$') {
            end--;
        }
        return s.substring(start, end).strip();
    }

    /**
     * Positions are absolute offsets into {@code source}, so error context
     * always points at the original input.
     */
    private final class Scan {
        private final String source;

        Scan(String source) {
            this.source = source;
        }

        void tokens(int start, int end, SemanticNode parent, int depth) {
            if (depth > maxNestingDepth) {
                throw new MathParseException("Maximum nesting depth exceeded", start, source);
            }
            int pos = start;
            while (pos < end) {
                char c = source.charAt(pos);

                if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '\\') {
                    pos = command(pos, end, parent, depth);
                } else if (c == '^') {
                    pos = script(pos, end, parent, depth, NodeType.SUPERSCRIPT,
                        SemanticNode.ROLE_EXPONENT, "Superscript without base");
                } else if (c == '_') {
                    pos = script(pos, end, parent, depth, NodeType.SUBSCRIPT,
                        SemanticNode.ROLE_SUBSCRIPT, "Subscript without base");
                } else if (c == '{') {
                    int close = matchingBrace(pos, end);
                    SemanticNode group = new SemanticNode(NodeType.GROUP);
                    tokens(pos + 1, close, group, depth + 1);
                    parent.addChild(group);
                    pos = close + 1;
                } else if (isNumberStart(pos, end)) {
                    int numberEnd = numberEnd(pos, end);
                    parent.addChild(new SemanticNode(NodeType.NUMBER, source.substring(pos, numberEnd)));
                    pos = numberEnd;
                } else {
                    int codePoint = source.codePointAt(pos);
                    String symbol = new String(Character.toChars(codePoint));
                    if (Character.isLetter(codePoint)) {
                        parent.addChild(new SemanticNode(NodeType.IDENTIFIER, symbol));
                    } else {
                        parent.addChild(symbol(symbol));
                    }
                    pos += Character.charCount(codePoint);
                }
            }
        }

        private SemanticNode symbol(String symbol) {
            if (OPERATORS.containsKey(symbol)) {
                return new SemanticNode(NodeType.OPERATOR, OPERATORS.get(symbol));
            }
            if (RELATIONS.containsKey(symbol)) {
                return new SemanticNode(NodeType.RELATION, RELATIONS.get(symbol));
            }
            if (DELIMITERS.contains(symbol)) {
                return new SemanticNode(NodeType.OPERATOR, symbol);
            }
            return new SemanticNode(NodeType.TEXT, symbol);
        }

        private int command(int pos, int end, SemanticNode parent, int depth) {
            int nameEnd = commandNameEnd(pos, end);
            if (nameEnd == pos + 1) {
                // Control symbol: \{ and \} are literal braces, spacing like \, or \\ is dropped
                if (pos + 1 < end) {
                    char next = source.charAt(pos + 1);
                    if (next == '{' || next == '}') {
                        parent.addChild(new SemanticNode(NodeType.OPERATOR, String.valueOf(next)));
                    }
                    return pos + 2;
                }
                return pos + 1;
            }

            String cmd = source.substring(pos + 1, nameEnd);
            String escaped = "\\" + cmd;

            switch (cmd) {
                case "frac":
                    return fraction(nameEnd, end, parent, depth);
                case "sqrt":
                    return root(nameEnd, end, parent, depth);
                case "sum":
                    parent.addChild(new SemanticNode(NodeType.SUM, "∑"));
                    return nameEnd;
                case "prod":
                    parent.addChild(new SemanticNode(NodeType.PRODUCT, "∏"));
                    return nameEnd;
                case "int":
                    parent.addChild(new SemanticNode(NodeType.INTEGRAL, "∫"));
                    return nameEnd;
                case "infty":
                    parent.addChild(new SemanticNode(NodeType.IDENTIFIER, "∞"));
                    return nameEnd;
                default:
                    break;
            }

            if (GREEK_LETTERS.containsKey(cmd)) {
                parent.addChild(new SemanticNode(NodeType.IDENTIFIER, GREEK_LETTERS.get(cmd)));
            } else if (OPERATORS.containsKey(escaped)) {
                parent.addChild(new SemanticNode(NodeType.OPERATOR, OPERATORS.get(escaped)));
            } else if (RELATIONS.containsKey(escaped)) {
                parent.addChild(new SemanticNode(NodeType.RELATION, RELATIONS.get(escaped)));
            } else if (FUNCTIONS.contains(cmd)) {
                parent.addChild(new SemanticNode(NodeType.FUNCTION, cmd));
            } else {
                logger.debug("Unknown LaTeX command {} kept as text", escaped);
                parent.addChild(new SemanticNode(NodeType.TEXT, escaped,
                    Map.of(SemanticNode.UNKNOWN_COMMAND, true)));
            }
            return nameEnd;
        }

        private int fraction(int pos, int end, SemanticNode parent, int depth) {
            pos = skipWhitespace(pos, end);
            if (pos >= end || source.charAt(pos) != '{') {
                throw new MathParseException("Expected { after \\frac", pos, source);
            }
            int numeratorEnd = matchingBrace(pos, end);
            int numeratorStart = pos + 1;

            pos = skipWhitespace(numeratorEnd + 1, end);
            if (pos >= end || source.charAt(pos) != '{') {
                throw new MathParseException("Expected { for denominator", pos, source);
            }
            int denominatorEnd = matchingBrace(pos, end);

            SemanticNode fraction = new SemanticNode(NodeType.FRACTION);
            SemanticNode numerator = SemanticNode.roleGroup(SemanticNode.ROLE_NUMERATOR);
            tokens(numeratorStart, numeratorEnd, numerator, depth + 1);
            fraction.addChild(numerator);

            SemanticNode denominator = SemanticNode.roleGroup(SemanticNode.ROLE_DENOMINATOR);
            tokens(pos + 1, denominatorEnd, denominator, depth + 1);
            fraction.addChild(denominator);

            parent.addChild(fraction);
            return denominatorEnd + 1;
        }

        private int root(int pos, int end, SemanticNode parent, int depth) {
            pos = skipWhitespace(pos, end);

            int indexStart = -1;
            int indexEnd = -1;
            if (pos < end && source.charAt(pos) == '[') {
                indexStart = pos + 1;
                indexEnd = matchingBracket(pos, end);
                pos = skipWhitespace(indexEnd + 1, end);
            }

            if (pos >= end || source.charAt(pos) != '{') {
                throw new MathParseException("Expected { after \\sqrt", pos, source);
            }
            int radicandEnd = matchingBrace(pos, end);

            SemanticNode radical;
            if (indexStart >= 0 && !source.substring(indexStart, indexEnd).isBlank()) {
                radical = new SemanticNode(NodeType.NROOT);
                SemanticNode index = SemanticNode.roleGroup(SemanticNode.ROLE_INDEX);
                tokens(indexStart, indexEnd, index, depth + 1);
                radical.addChild(index);
            } else {
                radical = new SemanticNode(NodeType.SQRT);
            }

            SemanticNode radicand = SemanticNode.roleGroup(SemanticNode.ROLE_RADICAND);
            tokens(pos + 1, radicandEnd, radicand, depth + 1);
            radical.addChild(radicand);

            parent.addChild(radical);
            return radicandEnd + 1;
        }

        /**
         * {@code ^} and {@code _}: the previous sibling becomes the base, the
         * payload is a braced group, a command, or one character.
         */
        private int script(int pos, int end, SemanticNode parent, int depth,
                           NodeType type, String role, String missingBase) {
            pos++;
            SemanticNode base = parent.removeLastChild();
            if (base == null) {
                throw new MathParseException(missingBase, pos, source);
            }

            pos = skipWhitespace(pos, end);
            int payloadStart = pos;
            int payloadEnd;
            if (pos < end && source.charAt(pos) == '{') {
                payloadEnd = matchingBrace(pos, end);
                payloadStart = pos + 1;
                pos = payloadEnd + 1;
            } else if (pos < end && source.charAt(pos) == '\\' && commandNameEnd(pos, end) > pos + 1) {
                payloadEnd = commandNameEnd(pos, end);
                pos = payloadEnd;
            } else if (pos < end) {
                payloadEnd = Math.min(pos + Character.charCount(source.codePointAt(pos)), end);
                pos = payloadEnd;
            } else {
                payloadEnd = pos;
            }

            SemanticNode script = new SemanticNode(type);
            script.addChild(base);
            SemanticNode payload = SemanticNode.roleGroup(role);
            tokens(payloadStart, payloadEnd, payload, depth + 1);
            script.addChild(payload);

            // Chained scripts deepen the tree without deepening the scan
            if (depth + height(script) > maxNestingDepth) {
                throw new MathParseException("Maximum nesting depth exceeded", payloadStart, source);
            }
            parent.addChild(script);
            return pos;
        }

        /**
         * Offset of the brace closing the one at {@code open}, counting depth.
         */
        private int matchingBrace(int open, int end) {
            int depth = 1;
            int pos = open + 1;
            while (pos < end) {
                char c = source.charAt(pos);
                if (c == '\\' && pos + 1 < end) {
                    pos += 2;
                    continue;
                }
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return pos;
                    }
                }
                pos++;
            }
            throw new MathParseException("Unclosed brace", pos, source);
        }

        private int matchingBracket(int open, int end) {
            int depth = 1;
            for (int pos = open + 1; pos < end; pos++) {
                char c = source.charAt(pos);
                if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                    if (depth == 0) {
                        return pos;
                    }
                }
            }
            throw new MathParseException("Unclosed [ in sqrt", open, source);
        }

        private int commandNameEnd(int backslash, int end) {
            int pos = backslash + 1;
            while (pos < end && isAsciiLetter(source.charAt(pos))) {
                pos++;
            }
            return pos;
        }

        private boolean isNumberStart(int pos, int end) {
            char c = source.charAt(pos);
            return isDigit(c) || (c == '.' && pos + 1 < end && isDigit(source.charAt(pos + 1)));
        }

        private int numberEnd(int pos, int end) {
            boolean seenDecimal = false;
            while (pos < end) {
                char c = source.charAt(pos);
                if (isDigit(c)) {
                    pos++;
                } else if (c == '.' && !seenDecimal) {
                    seenDecimal = true;
                    pos++;
                } else {
                    break;
                }
            }
            return pos;
        }

        private int skipWhitespace(int pos, int end) {
            while (pos < end && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
            return pos;
        }
    }

    /**
     * Edges on the longest path from {@code node} down to a leaf.
     */
    private static int height(SemanticNode node) {
        int height = 0;
        for (SemanticNode child : node.getChildren()) {
            height = Math.max(height, height(child) + 1);
        }
        return height;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
