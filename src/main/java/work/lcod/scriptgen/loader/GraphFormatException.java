package work.lcod.scriptgen.loader;

/**
 * Raised when a graph document cannot be turned into a snapshot.
 */
public final class GraphFormatException extends RuntimeException {
    private final String code;

    public GraphFormatException(String code, String message) {
        super(message);
        this.code = code;
    }

    public GraphFormatException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
