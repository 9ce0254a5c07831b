package im.arun.mathreader.render;

import im.arun.mathreader.braille.NemethConverter;
import im.arun.mathreader.braille.UebConverter;
import im.arun.mathreader.config.BrailleNotation;
import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.config.SpeechStyle;
import im.arun.mathreader.model.SemanticNode;
import im.arun.mathreader.speech.SpeechRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Renders one tree to every output modality with a shared configuration.
 *
 * <p>Braille notations live in a registry keyed by lower-case name. Nemeth
 * and UEB are registered up front; further notations are added through
 * {@link #registerBrailleNotation}.
 */
public class MathRenderer {
    private static final Logger logger = LoggerFactory.getLogger(MathRenderer.class);

    private final MathReaderConfig config;
    private SpeechRenderer speechRenderer;
    private final PlainTextRenderer plainTextRenderer;
    private final Map<String, Function<MathReaderConfig, ? extends Renderer>> brailleFactories =
        new ConcurrentHashMap<>();
    private final Map<String, Renderer> brailleRenderers = new ConcurrentHashMap<>();

    public MathRenderer() {
        this(new MathReaderConfig());
    }

    public MathRenderer(MathReaderConfig config) {
        this.config = config != null ? config.copy() : new MathReaderConfig();
        this.speechRenderer = new SpeechRenderer(this.config);
        this.plainTextRenderer = new PlainTextRenderer(this.config);
        registerBrailleNotation(NemethConverter.NOTATION, NemethConverter::new);
        registerBrailleNotation(UebConverter.NOTATION, UebConverter::new);
    }

    public String toSpeech(SemanticNode tree) {
        return speechRenderer.render(tree);
    }

    /**
     * Braille in the configured notation.
     */
    public String toBraille(SemanticNode tree) {
        BrailleNotation notation = config.getBraille().getNotation();
        return toBraille(tree, (notation != null ? notation : BrailleNotation.NEMETH).value());
    }

    /**
     * @throws IllegalArgumentException if no notation is registered under that name
     */
    public String toBraille(SemanticNode tree, String notation) {
        return brailleRenderer(notation).render(tree);
    }

    public String toSimpleText(SemanticNode tree) {
        return plainTextRenderer.render(tree);
    }

    /**
     * Adds or replaces a Braille notation. Names are case-insensitive.
     */
    public void registerBrailleNotation(String name, Function<MathReaderConfig, ? extends Renderer> factory) {
        String key = normalize(name);
        brailleFactories.put(key, Objects.requireNonNull(factory, "factory"));
        brailleRenderers.remove(key);
        logger.debug("Registered Braille notation {}", key);
    }

    /**
     * Switches speech verbosity on this renderer's own copy of the
     * configuration. Speech rules registered on the previous speech renderer
     * are not carried over.
     */
    public void setVerbosity(SpeechStyle style) {
        config.getSpeech().setStyle(Objects.requireNonNull(style, "style"));
        speechRenderer = new SpeechRenderer(config);
        logger.debug("Speech verbosity set to {}", style.value());
    }

    public MathReaderConfig getConfig() {
        return config;
    }

    public Set<String> getBrailleNotations() {
        return new TreeSet<>(brailleFactories.keySet());
    }

    public SpeechRenderer getSpeechRenderer() {
        return speechRenderer;
    }

    public Renderer brailleRenderer(String notation) {
        String key = normalize(notation);
        Function<MathReaderConfig, ? extends Renderer> factory = brailleFactories.get(key);
        if (factory == null) {
            throw new IllegalArgumentException(
                "Unknown Braille notation: " + notation + " (available: " + getBrailleNotations() + ")");
        }
        return brailleRenderers.computeIfAbsent(key, k -> factory.apply(config));
    }

    private static String normalize(String name) {
        Objects.requireNonNull(name, "notation");
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
