package im.arun.mathreader.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads {@link MathReaderConfig} from YAML and merges per-call overrides.
 * Lookup order: explicit file path, {@value #DEFAULT_RESOURCE} on the
 * classpath, built-in defaults.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String DEFAULT_RESOURCE = "math-reader.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MathReaderConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private MathReaderConfig loadDefaultConfig(String configPath) {
        try {
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), MathReaderConfig.class);
                }
                logger.warn("Config file {} not found, trying classpath", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, MathReaderConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new MathReaderConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new MathReaderConfig();
        }
    }

    /**
     * Returns a fresh copy of the defaults with {@code userOptions} applied.
     * Invalid values are logged and skipped.
     */
    public MathReaderConfig load(Map<String, Object> userOptions) {
        MathReaderConfig config = defaultConfig.copy();

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "speech_style":
                    case "speechStyle":
                        config.getSpeech().setStyle(SpeechStyle.fromValue(String.valueOf(value)));
                        break;
                    case "speech_language":
                    case "speechLanguage":
                        if (value instanceof String) config.getSpeech().setLanguage((String) value);
                        break;
                    case "speech_rate":
                    case "speechRate":
                        config.getSpeech().setRate(parseDouble(value));
                        break;
                    case "announce_structure":
                    case "announceStructure":
                        config.getSpeech().setAnnounceStructure(parseBoolean(value));
                        break;
                    case "braille_notation":
                    case "brailleNotation":
                        config.getBraille().setNotation(BrailleNotation.fromValue(String.valueOf(value)));
                        break;
                    case "include_indicators":
                    case "includeIndicators":
                        config.getBraille().setIncludeIndicators(parseBoolean(value));
                        break;
                    case "unsupported_fallback":
                    case "unsupportedFallback":
                        config.getBraille().setUnsupportedFallback(
                            UnsupportedFallback.fromValue(String.valueOf(value)));
                        break;
                    case "max_nesting_depth":
                    case "maxNestingDepth":
                        config.setMaxNestingDepth(parseInt(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    public MathReaderConfig getDefaultConfig() {
        return defaultConfig.copy();
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private double parseDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(String.valueOf(value).trim());
    }

    private int parseInt(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(String.valueOf(value).trim());
    }
}
