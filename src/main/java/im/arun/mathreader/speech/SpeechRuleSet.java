package im.arun.mathreader.speech;

import im.arun.mathreader.config.SpeechStyle;

import java.util.EnumMap;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Phrase and symbol-name tables for English math speech. Several concise
 * and superbrief phrases are empty on purpose: the renderer drops empty
 * fragments, which is how lower verbosity omits wrapper phrases.
 */
public class SpeechRuleSet {

    private static final Map<String, Map<SpeechStyle, String>> PHRASES = Map.ofEntries(
        entry("fraction_start", phrases("start fraction", "", "frac")),
        entry("fraction_over", phrases("over", "over", "")),
        entry("fraction_end", phrases("end fraction", "", "")),
        entry("superscript", phrases("to the power of", "to the", "exp")),
        entry("subscript", phrases("subscript", "sub", "sub")),
        entry("sqrt", phrases("square root of", "square root of", "sqrt")),
        entry("sqrt_end", phrases("end root", "", "")),
        entry("nroot", phrases("root of", "root", "root")),
        entry("sum", phrases("summation of", "sum of", "sum")),
        entry("integral", phrases("integral of", "integral of", "int"))
    );

    private static final Map<String, String> OPERATOR_NAMES = Map.ofEntries(
        entry("+", "plus"),
        entry("-", "minus"),
        entry("−", "minus"),
        entry("×", "times"),
        entry("·", "times"),
        entry("÷", "divided by"),
        entry("±", "plus or minus"),
        entry("∓", "minus or plus"),
        entry("(", "open paren"),
        entry(")", "close paren"),
        entry("[", "open bracket"),
        entry("]", "close bracket")
    );

    private static final Map<String, String> RELATION_NAMES = Map.ofEntries(
        entry("=", "equals"),
        entry("<", "less than"),
        entry(">", "greater than"),
        entry("≤", "less than or equal to"),
        entry("≥", "greater than or equal to"),
        entry("≠", "not equal to"),
        entry("≈", "approximately equal to"),
        entry("≡", "is identical to")
    );

    private static final Map<String, String> NUMBER_NAMES = Map.of("∞", "infinity");

    private static final Map<String, String> IDENTIFIER_NAMES = Map.ofEntries(
        entry("α", "alpha"), entry("β", "beta"), entry("γ", "gamma"), entry("δ", "delta"),
        entry("ε", "epsilon"), entry("ζ", "zeta"), entry("η", "eta"), entry("θ", "theta"),
        entry("ι", "iota"), entry("κ", "kappa"), entry("λ", "lambda"), entry("μ", "mu"),
        entry("ν", "nu"), entry("ξ", "xi"), entry("π", "pi"), entry("ρ", "rho"),
        entry("σ", "sigma"), entry("τ", "tau"), entry("υ", "upsilon"), entry("φ", "phi"),
        entry("χ", "chi"), entry("ψ", "psi"), entry("ω", "omega"),
        entry("Α", "capital alpha"), entry("Β", "capital beta"), entry("Γ", "capital gamma"),
        entry("Δ", "capital delta"), entry("Θ", "capital theta"), entry("Λ", "capital lambda"),
        entry("Ξ", "capital xi"), entry("Π", "capital pi"), entry("Σ", "capital sigma"),
        entry("Φ", "capital phi"), entry("Ψ", "capital psi"), entry("Ω", "capital omega"),
        entry("∞", "infinity")
    );

    private static Map<SpeechStyle, String> phrases(String verbose, String concise, String superbrief) {
        Map<SpeechStyle, String> byStyle = new EnumMap<>(SpeechStyle.class);
        byStyle.put(SpeechStyle.VERBOSE, verbose);
        byStyle.put(SpeechStyle.CONCISE, concise);
        byStyle.put(SpeechStyle.SUPERBRIEF, superbrief);
        return byStyle;
    }

    /**
     * Phrase for {@code key} at {@code verbosity}; falls back to the verbose
     * phrase, or "" for an unknown key.
     */
    public String getPhrase(String key, SpeechStyle verbosity) {
        Map<SpeechStyle, String> byStyle = PHRASES.get(key);
        if (byStyle == null) {
            return "";
        }
        String phrase = byStyle.get(verbosity);
        return phrase != null ? phrase : byStyle.getOrDefault(SpeechStyle.VERBOSE, "");
    }

    public String getOperatorName(String operator) {
        return OPERATOR_NAMES.getOrDefault(operator, operator);
    }

    public String getRelationName(String relation) {
        return RELATION_NAMES.getOrDefault(relation, relation);
    }

    public String getIdentifierName(String identifier) {
        return IDENTIFIER_NAMES.getOrDefault(identifier, identifier);
    }

    public String getNumberName(String number) {
        return NUMBER_NAMES.getOrDefault(number, number);
    }
}
