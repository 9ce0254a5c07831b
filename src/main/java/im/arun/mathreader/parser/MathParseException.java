package im.arun.mathreader.parser;

/**
 * Raised when LaTeX or MathML input cannot be turned into a tree.
 * Fatal for the one expression being parsed only.
 */
public class MathParseException extends RuntimeException {
    private static final int CONTEXT_RADIUS = 10;

    private final String reason;
    private final Integer position;
    private final String source;

    public MathParseException(String reason) {
        this(reason, null, null, null);
    }

    public MathParseException(String reason, Integer position, String source) {
        this(reason, position, source, null);
    }

    public MathParseException(String reason, Throwable cause) {
        this(reason, null, null, cause);
    }

    public MathParseException(String reason, Integer position, String source, Throwable cause) {
        super(format(reason, position, source), cause);
        this.reason = reason;
        this.position = position;
        this.source = source;
    }

    /**
     * The bare message without the context block.
     */
    public String getReason() {
        return reason;
    }

    public Integer getPosition() {
        return position;
    }

    public String getSource() {
        return source;
    }

    private static String format(String reason, Integer position, String source) {
        if (position == null || source == null || source.isEmpty()) {
            return reason;
        }
        int start = Math.max(0, position - CONTEXT_RADIUS);
        int end = Math.min(source.length(), position + CONTEXT_RADIUS);
        int caret = Math.min(position, source.length()) - start;
        String context = source.substring(start, Math.max(start, end));
        return reason
            + "\n  Context: ..." + context + "..."
            + "\n           " + " ".repeat(Math.max(0, caret)) + "^";
    }
}
