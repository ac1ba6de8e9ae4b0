package dev.abapfmt.source;

/**
 * Raised when a document was read but contains no formattable unit.
 */
public class UpstreamObjectMissingException extends RuntimeException {

    public UpstreamObjectMissingException(String message) {
        super(message);
    }
}
