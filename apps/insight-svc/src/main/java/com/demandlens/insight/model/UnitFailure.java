package com.demandlens.insight.model;

import com.demandlens.insight.exception.AnalysisException;

/**
 * One lag, window, factor or product that was left out of a multi-unit result.
 */
public record UnitFailure(String unit, AnalysisException.ErrorKind kind, String reason) {

    public static UnitFailure of(String unit, AnalysisException ex) {
        return new UnitFailure(unit, ex.kind(), ex.getMessage());
    }

    public static UnitFailure unexpected(String unit, Throwable ex) {
        String reason = ex.getMessage() != null ? ex.getMessage() : ex.toString();
        return new UnitFailure(unit, AnalysisException.ErrorKind.UNEXPECTED, reason);
    }
}
