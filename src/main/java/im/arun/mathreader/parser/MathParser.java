package im.arun.mathreader.parser;

import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.model.SemanticNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Entry point for turning LaTeX or MathML text into a semantic tree.
 *
 * <pre>
 * MathParser parser = new MathParser();
 * SemanticNode tree = parser.parse("\\frac{a}{b}");
 * SemanticNode same = parser.parse("&lt;math&gt;&lt;mfrac&gt;&lt;mi&gt;a&lt;/mi&gt;&lt;mi&gt;b&lt;/mi&gt;&lt;/mfrac&gt;&lt;/math&gt;");
 * </pre>
 */
public class MathParser {
    private static final Logger logger = LoggerFactory.getLogger(MathParser.class);
    private static final Pattern MATHML_PREFIX = Pattern.compile("^<(\\?xml|([A-Za-z_][\\w.-]*:)?math\\b)");

    private final LatexParser latexParser;
    private final MathmlParser mathmlParser;
    private final List<InputFormat> inputFormats = new CopyOnWriteArrayList<>();

    public MathParser() {
        this(new MathReaderConfig());
    }

    public MathParser(MathReaderConfig config) {
        this.latexParser = new LatexParser(config.getMaxNestingDepth());
        this.mathmlParser = new MathmlParser(config.getMaxNestingDepth());
    }

    /**
     * Adds or replaces an input format. Registered formats are tried in
     * registration order before MathML and LaTeX detection; the first whose
     * {@code canParse} accepts the trimmed input parses it. Names are
     * case-insensitive.
     */
    public void registerInputFormat(String name, Predicate<String> canParse,
                                    Function<String, SemanticNode> parser) {
        InputFormat format = new InputFormat(normalize(name),
            Objects.requireNonNull(canParse, "canParse"), Objects.requireNonNull(parser, "parser"));
        inputFormats.removeIf(existing -> existing.name.equals(format.name));
        inputFormats.add(format);
        logger.debug("Registered input format {}", format.name);
    }

    public List<String> getInputFormats() {
        return inputFormats.stream().map(format -> format.name).collect(Collectors.toList());
    }

    /**
     * Uses the first registered input format that accepts the trimmed input.
     * Otherwise parses MathML when the input starts with an XML declaration or
     * a {@code <math} element, LaTeX otherwise.
     *
     * @throws MathParseException if the input is malformed
     */
    public SemanticNode parse(String input) {
        String trimmed = input == null ? "" : input.strip();
        for (InputFormat format : inputFormats) {
            if (format.canParse.test(trimmed)) {
                logger.debug("Detected {} input", format.name);
                return parseWith(format, trimmed);
            }
        }
        if (isMathml(trimmed)) {
            logger.debug("Detected MathML input");
            return parseMathml(trimmed);
        }
        logger.debug("Detected LaTeX input");
        return parseLatex(trimmed);
    }

    public SemanticNode parseLatex(String latex) {
        return latexParser.parse(latex);
    }

    public SemanticNode parseMathml(String mathml) {
        return mathmlParser.parse(mathml);
    }

    private static SemanticNode parseWith(InputFormat format, String input) {
        SemanticNode tree;
        try {
            tree = format.parser.apply(input);
        } catch (MathParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MathParseException("Input format " + format.name + " failed: " + e.getMessage(), e);
        }
        if (tree == null) {
            throw new MathParseException("Input format " + format.name + " produced no tree");
        }
        return tree;
    }

    private static String normalize(String name) {
        Objects.requireNonNull(name, "name");
        return name.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isMathml(String trimmed) {
        return MATHML_PREFIX.matcher(trimmed).find();
    }

    private static final class InputFormat {
        private final String name;
        private final Predicate<String> canParse;
        private final Function<String, SemanticNode> parser;

        InputFormat(String name, Predicate<String> canParse, Function<String, SemanticNode> parser) {
            this.name = name;
            this.canParse = canParse;
            this.parser = parser;
        }
    }
}
