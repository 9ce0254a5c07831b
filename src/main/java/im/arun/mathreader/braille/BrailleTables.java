package im.arun.mathreader.braille;

import java.util.HashMap;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Cells shared by the literary-based codes: the a-z alphabet and the
 * letter cells Greek letters are written with.
 */
final class BrailleTables {

    static final Map<Character, String> LETTERS = Map.ofEntries(
        entry('a', "⠁"), entry('b', "⠃"), entry('c', "⠉"), entry('d', "⠙"), entry('e', "⠑"),
        entry('f', "⠋"), entry('g', "⠛"), entry('h', "⠓"), entry('i', "⠊"), entry('j', "⠚"),
        entry('k', "⠅"), entry('l', "⠇"), entry('m', "⠍"), entry('n', "⠝"), entry('o', "⠕"),
        entry('p', "⠏"), entry('q', "⠟"), entry('r', "⠗"), entry('s', "⠎"), entry('t', "⠞"),
        entry('u', "⠥"), entry('v', "⠧"), entry('w', "⠺"), entry('x', "⠭"), entry('y', "⠽"),
        entry('z', "⠵")
    );

    private static final Map<String, String> GREEK_LOWER = Map.ofEntries(
        entry("α", "⠁"), entry("β", "⠃"), entry("γ", "⠛"), entry("δ", "⠙"),
        entry("ε", "⠑"), entry("ζ", "⠵"), entry("η", "⠱"), entry("θ", "⠹"),
        entry("ι", "⠊"), entry("κ", "⠅"), entry("λ", "⠇"), entry("μ", "⠍"),
        entry("ν", "⠝"), entry("ξ", "⠭"), entry("π", "⠏"), entry("ρ", "⠗"),
        entry("σ", "⠎"), entry("τ", "⠞"), entry("υ", "⠥"), entry("φ", "⠋"),
        entry("χ", "⠯"), entry("ψ", "⠽"), entry("ω", "⠺")
    );

    private static final Map<String, String> GREEK_UPPER = Map.ofEntries(
        entry("Α", "⠁"), entry("Β", "⠃"), entry("Γ", "⠛"), entry("Δ", "⠙"),
        entry("Θ", "⠹"), entry("Λ", "⠇"), entry("Ξ", "⠭"), entry("Π", "⠏"),
        entry("Σ", "⠎"), entry("Φ", "⠋"), entry("Ψ", "⠽"), entry("Ω", "⠺")
    );

    private BrailleTables() {}

    /**
     * Greek letters prefixed with {@code greekIndicator}; capitals also get
     * {@code capitalIndicator} in front.
     */
    static Map<String, String> greek(String greekIndicator, String capitalIndicator) {
        Map<String, String> table = new HashMap<>();
        GREEK_LOWER.forEach((letter, cell) -> table.put(letter, greekIndicator + cell));
        GREEK_UPPER.forEach((letter, cell) -> table.put(letter, capitalIndicator + greekIndicator + cell));
        return Map.copyOf(table);
    }
}
