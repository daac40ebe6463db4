package com.unlistedjobs.archetype;

/**
 * Standard runtime exception of the inference engine: an {@link ErrorKind} plus an optional location
 * (usually the cell key or archetype key the failure belongs to).
 */
public class EstimationException extends RuntimeException {

    private final ErrorKind errorKind;
    private final String where;

    public EstimationException(ErrorKind errorKind, String message) {
        this(errorKind, message, null, null);
    }

    public EstimationException(ErrorKind errorKind, String message, String where) {
        this(errorKind, message, where, null);
    }

    public EstimationException(ErrorKind errorKind, String message, Throwable cause) {
        this(errorKind, message, null, cause);
    }

    public EstimationException(ErrorKind errorKind, String message, String where, Throwable cause) {
        super(where == null ? message : message + " [" + where + "]", cause);
        this.errorKind = errorKind;
        this.where = where;
    }

    public ErrorKind getErrorKind() { return errorKind; }

    public String getWhere() { return where; }
}
