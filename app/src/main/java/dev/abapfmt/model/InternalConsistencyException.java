package dev.abapfmt.model;

/**
 * Signals that statement data violates an invariant the formatter relies on. Not recoverable.
 */
public class InternalConsistencyException extends IllegalStateException {

    private final SourceSpan span;

    public InternalConsistencyException(String message, SourceSpan span) {
        super(message + " at " + span.describe());
        this.span = span;
    }

    public SourceSpan span() {
        return span;
    }
}
