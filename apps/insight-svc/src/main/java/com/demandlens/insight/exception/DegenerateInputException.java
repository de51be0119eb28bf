package com.demandlens.insight.exception;

public class DegenerateInputException extends AnalysisException {

    public DegenerateInputException(String message) {
        super(ErrorKind.DEGENERATE_INPUT, message);
    }

    public DegenerateInputException(String message, Throwable cause) {
        super(ErrorKind.DEGENERATE_INPUT, message, cause);
    }
}
