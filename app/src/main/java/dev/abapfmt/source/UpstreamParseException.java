package dev.abapfmt.source;

/**
 * Raised when source text cannot be turned into a statement list.
 */
public class UpstreamParseException extends RuntimeException {

    public UpstreamParseException(String message) {
        super(message);
    }

    public UpstreamParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
