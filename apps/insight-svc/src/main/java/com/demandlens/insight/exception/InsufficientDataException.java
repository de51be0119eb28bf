package com.demandlens.insight.exception;

public class InsufficientDataException extends AnalysisException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String what, int required, int actual) {
        super(ErrorKind.INSUFFICIENT_DATA, what + " requires at least " + required + " observations but got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int required() {
        return required;
    }

    public int actual() {
        return actual;
    }
}
