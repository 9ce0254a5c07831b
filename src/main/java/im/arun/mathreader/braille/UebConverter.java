package im.arun.mathreader.braille;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.model.SemanticNode;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Unified English Braille, technical material. Digits are the upper-cell
 * a-j forms after the numeric indicator, and capitals are marked per letter.
 */
public class UebConverter extends BrailleConverter {

    public static final String NOTATION = "ueb";

    static final Map<Character, String> DIGITS = Map.ofEntries(
        entry('0', "⠚"), entry('1', "⠁"), entry('2', "⠃"), entry('3', "⠉"), entry('4', "⠙"),
        entry('5', "⠑"), entry('6', "⠋"), entry('7', "⠛"), entry('8', "⠓"), entry('9', "⠊")
    );

    static final Map<String, String> GREEK = BrailleTables.greek("⠨", "⠠");

    static final Map<String, String> OPERATORS = Map.ofEntries(
        entry("+", "⠬"),
        entry("-", "⠤"),
        entry("−", "⠤"),
        entry("×", "⠐⠦"),
        entry("·", "⠐⠲"),
        entry("÷", "⠐⠌"),
        entry("(", "⠐⠣"),
        entry(")", "⠐⠜"),
        entry("[", "⠨⠣"),
        entry("]", "⠨⠜")
    );

    static final Map<String, String> RELATIONS = Map.ofEntries(
        entry("=", "⠐⠶"),
        entry("<", "⠐⠪"),
        entry(">", "⠐⠕"),
        entry("≤", "⠐⠪⠶"),
        entry("≥", "⠐⠕⠶"),
        entry("≠", "⠐⠶⠈⠱")
    );

    public static final String NUMERIC_INDICATOR = "⠼";
    public static final String GRADE1_INDICATOR = "⠰";
    public static final String CAPITAL_INDICATOR = "⠠";
    public static final String DECIMAL_POINT = "⠲";
    public static final String FRACTION_OPEN = "⠷";
    public static final String FRACTION_LINE = "⠌";
    public static final String FRACTION_CLOSE = "⠾";
    public static final String SUPERSCRIPT_INDICATOR = "⠔";
    public static final String SUBSCRIPT_INDICATOR = "⠢";
    public static final String RADICAL_OPEN = "⠩";
    public static final String RADICAL_CLOSE = "⠱";
    public static final String INFINITY = "⠼⠿";

    public UebConverter() {
        this(new MathReaderConfig());
    }

    public UebConverter(MathReaderConfig config) {
        super(config);
    }

    @Override
    public String notationName() {
        return NOTATION;
    }

    @Override
    protected Map<Character, String> letters() {
        return BrailleTables.LETTERS;
    }

    @Override
    protected Map<Character, String> digits() {
        return DIGITS;
    }

    @Override
    public String visitNumber(SemanticNode node) {
        String prefix = includeIndicators() ? NUMERIC_INDICATOR : "";
        return prefix + mapDigits(node.getContent(), DECIMAL_POINT);
    }

    @Override
    public String visitIdentifier(SemanticNode node) {
        String content = node.getContent();

        if (GREEK.containsKey(content)) {
            return GREEK.get(content);
        }
        if ("∞".equals(content)) {
            return INFINITY;
        }
        StringBuilder sb = new StringBuilder();
        for (char c : content.toCharArray()) {
            char lower = Character.toLowerCase(c);
            if (BrailleTables.LETTERS.containsKey(lower)) {
                if (Character.isUpperCase(c)) {
                    sb.append(CAPITAL_INDICATOR);
                }
                sb.append(BrailleTables.LETTERS.get(lower));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public String visitOperator(SemanticNode node) {
        return OPERATORS.getOrDefault(node.getContent(), node.getContent());
    }

    @Override
    public String visitRelation(SemanticNode node) {
        return RELATIONS.getOrDefault(node.getContent(), node.getContent());
    }

    @Override
    public String visitFraction(SemanticNode node) {
        return FRACTION_OPEN + renderChild(node, 0) + FRACTION_LINE + renderChild(node, 1) + FRACTION_CLOSE;
    }

    @Override
    public String visitSuperscript(SemanticNode node) {
        return renderChild(node, 0) + SUPERSCRIPT_INDICATOR + renderChild(node, 1);
    }

    @Override
    public String visitSubscript(SemanticNode node) {
        return renderChild(node, 0) + SUBSCRIPT_INDICATOR + renderChild(node, 1);
    }

    @Override
    public String visitSqrt(SemanticNode node) {
        return RADICAL_OPEN + renderChild(node, 0) + RADICAL_CLOSE;
    }

    // Same index placement as Nemeth until the UEB ordering is settled
    @Override
    public String visitNRoot(SemanticNode node) {
        return renderChild(node, 0) + RADICAL_OPEN + renderChild(node, 1) + RADICAL_CLOSE;
    }

    @Override
    public String visitText(SemanticNode node) {
        return renderText(node.getContent());
    }

    @Override
    protected String renderText(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            if (Character.isUpperCase(c) && BrailleTables.LETTERS.containsKey(Character.toLowerCase(c))) {
                sb.append(CAPITAL_INDICATOR);
            }
            sb.append(transliterate(String.valueOf(Character.toLowerCase(c))));
        }
        return sb.toString();
    }
}
