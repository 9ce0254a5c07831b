package im.arun.mathreader.braille;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.model.SemanticNode;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Nemeth Braille Code for Mathematics.
 *
 * <p>Key cells: numeric indicator ⠼, fraction ⠹ ⠌ ⠼, superscript ⠘,
 * subscript ⠰, radical ⠜ ... ⠻.
 *
 * <p>Limitations: no return-to-baseline indicator is written after a
 * script, and the multipurpose, grade 1 and shape indicators are defined
 * but not used by any rule yet.
 */
public class NemethConverter extends BrailleConverter {

    public static final String NOTATION = "nemeth";

    // Digits use the lower-cell forms, preceded by the numeric indicator
    static final Map<Character, String> DIGITS = Map.ofEntries(
        entry('0', "⠴"), entry('1', "⠂"), entry('2', "⠆"), entry('3', "⠒"), entry('4', "⠲"),
        entry('5', "⠢"), entry('6', "⠖"), entry('7', "⠶"), entry('8', "⠦"), entry('9', "⠔")
    );

    static final Map<String, String> GREEK = BrailleTables.greek("⠨", "⠠");

    static final Map<String, String> OPERATORS = Map.ofEntries(
        entry("+", "⠬"),
        entry("-", "⠤"),
        entry("−", "⠤"),
        entry("×", "⠡"),
        entry("·", "⠡"),
        entry("÷", "⠌"),
        entry("±", "⠬⠤"),
        entry("(", "⠷"),
        entry(")", "⠾"),
        entry("[", "⠈⠷"),
        entry("]", "⠈⠾")
    );

    // Relations are spaced on both sides
    static final Map<String, String> RELATIONS = Map.ofEntries(
        entry("=", "⠀⠿⠀"),
        entry("<", "⠀⠪⠀"),
        entry(">", "⠀⠻⠀"),
        entry("≤", "⠀⠪⠿⠀"),
        entry("≥", "⠀⠻⠿⠀"),
        entry("≠", "⠀⠿⠈⠱⠀"),
        entry("≈", "⠀⠈⠿⠀")
    );

    public static final String NUMERIC_INDICATOR = "⠼";
    public static final String CAPITAL_INDICATOR = "⠠";
    public static final String DECIMAL_POINT = "⠨";
    public static final String FRACTION_OPEN = "⠹";
    public static final String FRACTION_LINE = "⠌";
    public static final String FRACTION_CLOSE = "⠼";
    public static final String SUPERSCRIPT_INDICATOR = "⠘";
    public static final String SUBSCRIPT_INDICATOR = "⠰";
    public static final String RADICAL_OPEN = "⠜";
    public static final String RADICAL_CLOSE = "⠻";
    public static final String INFINITY = "⠠⠿";
    public static final String SUMMATION = "⠠⠨⠎";
    public static final String INTEGRAL = "⠮";

    // Defined by the code, not yet used by any rule
    public static final String BASELINE_INDICATOR = "⠐";
    public static final String MULTIPURPOSE_INDICATOR = "⠸";
    public static final String GRADE1_SYMBOL_INDICATOR = "⠰⠰";
    public static final String GRADE1_WORD_INDICATOR = "⠰⠰⠰";
    public static final String SHAPE_INDICATOR = "⠫";

    public NemethConverter() {
        this(new MathReaderConfig());
    }

    public NemethConverter(MathReaderConfig config) {
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
        if (content.length() == 1) {
            char c = content.charAt(0);
            char lower = Character.toLowerCase(c);
            if (BrailleTables.LETTERS.containsKey(lower)) {
                String letter = BrailleTables.LETTERS.get(lower);
                return Character.isUpperCase(c) ? CAPITAL_INDICATOR + letter : letter;
            }
        }
        return transliterate(content.toLowerCase(Locale.ROOT));
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

    // Index is written before the radical
    @Override
    public String visitNRoot(SemanticNode node) {
        return renderChild(node, 0) + RADICAL_OPEN + renderChild(node, 1) + RADICAL_CLOSE;
    }

    @Override
    public String visitSum(SemanticNode node) {
        return SUMMATION + renderChildren(node);
    }

    @Override
    public String visitIntegral(SemanticNode node) {
        return INTEGRAL + renderChildren(node);
    }

    @Override
    public String visitText(SemanticNode node) {
        return renderText(node.getContent());
    }

    @Override
    protected String renderText(String text) {
        return transliterate(text.toLowerCase(Locale.ROOT));
    }
}
