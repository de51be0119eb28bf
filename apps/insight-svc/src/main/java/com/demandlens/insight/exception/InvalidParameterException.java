package com.demandlens.insight.exception;

public class InvalidParameterException extends AnalysisException {

    public InvalidParameterException(String message) {
        super(ErrorKind.INVALID_PARAMETER, message);
    }
}
