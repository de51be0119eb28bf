package com.demandlens.insight.exception;

/**
 * Base type for failures raised synchronously by the analytics core.
 * Every subclass maps to exactly one {@link ErrorKind}.
 */
public abstract class AnalysisException extends RuntimeException {

    public enum ErrorKind {
        INSUFFICIENT_DATA,
        DEGENERATE_INPUT,
        INVALID_PARAMETER,
        UNEXPECTED
    }

    private final ErrorKind kind;

    protected AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
