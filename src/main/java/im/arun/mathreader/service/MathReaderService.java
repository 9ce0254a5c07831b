package im.arun.mathreader.service;

import im.arun.mathreader.braille.NemethConverter;
import im.arun.mathreader.braille.UebConverter;
import im.arun.mathreader.config.MathReaderConfig;
import im.arun.mathreader.model.ConversionResult;
import im.arun.mathreader.model.SemanticNode;
import im.arun.mathreader.parser.MathParseException;
import im.arun.mathreader.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Converts expressions into every output at once, singly or as a batch.
 */
public class MathReaderService {
    private static final Logger logger = LoggerFactory.getLogger(MathReaderService.class);

    private final MathReader reader;

    public MathReaderService() {
        this(new MathReaderConfig());
    }

    public MathReaderService(MathReaderConfig config) {
        this.reader = new MathReader(config);
    }

    /**
     * Parses and renders one expression. A parse failure is reported in the
     * result's {@code error} rather than thrown.
     */
    public ConversionResult convert(String expression) {
        SemanticNode tree;
        try {
            tree = reader.parse(expression);
        } catch (MathParseException e) {
            logger.warn("Failed to parse expression {}: {}", expression, e.getReason());
            return ConversionResult.failure(expression, e.getMessage());
        }

        ConversionResult result = new ConversionResult();
        result.setInput(expression);
        result.setSpeech(reader.toSpeech(tree));
        result.setBraille(new ConversionResult.BrailleOutput(
            reader.toBraille(tree, NemethConverter.NOTATION),
            reader.toBraille(tree, UebConverter.NOTATION)));
        result.setStructure(reader.getStructure(tree));
        return result;
    }

    /**
     * Converts every expression concurrently on the shared executor. Results
     * come back in input order; a failing expression never fails the batch.
     */
    public List<ConversionResult> convertAll(List<String> expressions) {
        logger.info("Converting {} expressions", expressions.size());

        ExecutorService executor = ExecutorProvider.getExecutor();
        List<CompletableFuture<ConversionResult>> futures = expressions.stream()
            .map(expression -> CompletableFuture.supplyAsync(() -> convert(expression), executor)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    logger.error("Unexpected failure converting expression {}", expression, cause);
                    return ConversionResult.failure(expression, "Conversion failed: " + cause);
                }))
            .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<ConversionResult> results = futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());

        long failed = results.stream().filter(r -> !r.isSuccessful()).count();
        logger.info("Conversion complete: {} total, {} succeeded, {} failed",
            results.size(), results.size() - failed, failed);
        return results;
    }

    public MathReader getReader() {
        return reader;
    }
}
