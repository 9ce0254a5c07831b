package im.arun.mathreader.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @Test
    void loadsClasspathDefaults() {
        MathReaderConfig config = new ConfigLoader().load(null);

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
        assertThat(config.getSpeech().getLanguage()).isEqualTo("en");
        assertThat(config.getSpeech().getRate()).isEqualTo(1.0);
        assertThat(config.getBraille().getNotation()).isEqualTo(BrailleNotation.NEMETH);
        assertThat(config.getBraille().isIncludeIndicators()).isTrue();
        assertThat(config.getBraille().getUnsupportedFallback()).isEqualTo(UnsupportedFallback.DESCRIBE);
        assertThat(config.getMaxNestingDepth()).isEqualTo(200);
    }

    @Test
    void readsExplicitYamlFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("reader.yaml");
        Files.writeString(file, String.join("\n",
                "speech:",
                "  style: Concise",
                "  rate: 1.5",
                "braille:",
                "  notation: ueb",
                "  includeIndicators: false",
                "maxNestingDepth: 50",
                ""));

        MathReaderConfig config = new ConfigLoader(file.toString()).getDefaultConfig();

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.CONCISE);
        assertThat(config.getSpeech().getRate()).isEqualTo(1.5);
        assertThat(config.getSpeech().getLanguage()).isEqualTo("en");
        assertThat(config.getBraille().getNotation()).isEqualTo(BrailleNotation.UEB);
        assertThat(config.getBraille().isIncludeIndicators()).isFalse();
        assertThat(config.getMaxNestingDepth()).isEqualTo(50);
    }

    @Test
    void fallsBackWhenFileMissing(@TempDir Path tempDir) {
        MathReaderConfig config = new ConfigLoader(tempDir.resolve("absent.yaml").toString()).getDefaultConfig();

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
    }

    @Test
    void fallsBackWhenYamlInvalid(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "speech:\n  style: shouting\n");

        MathReaderConfig config = new ConfigLoader(file.toString()).getDefaultConfig();

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
    }

    @Test
    void mergesOverridesInEitherCase() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("speech_style", "superbrief");
        overrides.put("brailleNotation", "UEB");
        overrides.put("include_indicators", "no");
        overrides.put("announceStructure", "yes");
        overrides.put("speech_rate", "0.8");
        overrides.put("max_nesting_depth", 64);
        overrides.put("unsupported_fallback", "warn");

        MathReaderConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.SUPERBRIEF);
        assertThat(config.getBraille().getNotation()).isEqualTo(BrailleNotation.UEB);
        assertThat(config.getBraille().isIncludeIndicators()).isFalse();
        assertThat(config.getSpeech().isAnnounceStructure()).isTrue();
        assertThat(config.getSpeech().getRate()).isEqualTo(0.8);
        assertThat(config.getMaxNestingDepth()).isEqualTo(64);
        assertThat(config.getBraille().getUnsupportedFallback()).isEqualTo(UnsupportedFallback.WARN);
    }

    @Test
    void skipsInvalidAndUnknownOverrides() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("speech_style", "whisper");
        overrides.put("max_nesting_depth", "deep");
        overrides.put("colour", "blue");

        MathReaderConfig config = new ConfigLoader().load(overrides);

        assertThat(config.getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
        assertThat(config.getMaxNestingDepth()).isEqualTo(200);
    }

    @Test
    void overridesDoNotLeakIntoDefaults() {
        ConfigLoader loader = new ConfigLoader();

        loader.load(Map.of("speech_style", "concise"));

        assertThat(loader.getDefaultConfig().getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
        assertThat(loader.load(Map.of()).getSpeech().getStyle()).isEqualTo(SpeechStyle.VERBOSE);
    }

    @Test
    void parsesEnumValuesCaseInsensitively() {
        assertThat(SpeechStyle.fromValue(" Verbose ")).isEqualTo(SpeechStyle.VERBOSE);
        assertThat(BrailleNotation.fromValue("NEMETH")).isEqualTo(BrailleNotation.NEMETH);
        assertThat(UnsupportedFallback.fromValue("Error").isReserved()).isTrue();
        assertThat(UnsupportedFallback.DESCRIBE.isReserved()).isFalse();
        assertThatThrownBy(() -> BrailleNotation.fromValue("grade2"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("grade2");
    }
}
