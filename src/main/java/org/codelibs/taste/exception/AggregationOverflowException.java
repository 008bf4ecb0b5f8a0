package org.codelibs.taste.exception;

public class AggregationOverflowException extends TasteException {

    private static final long serialVersionUID = 1L;

    public AggregationOverflowException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public AggregationOverflowException(final String message) {
        super(message);
    }

}
