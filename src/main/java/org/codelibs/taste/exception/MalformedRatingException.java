package org.codelibs.taste.exception;

public class MalformedRatingException extends TasteException {

    private static final long serialVersionUID = 1L;

    public MalformedRatingException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public MalformedRatingException(final String message) {
        super(message);
    }

}
