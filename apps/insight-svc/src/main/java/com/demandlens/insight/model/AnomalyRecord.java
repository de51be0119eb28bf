package com.demandlens.insight.model;

import java.time.LocalDate;

public record AnomalyRecord(
        String groupKey,
        String periodLabel,
        LocalDate periodStart,
        LocalDate periodEnd,
        double actual,
        double expected,
        double deviation,
        double zScore,
        Severity severity,
        Kind kind
) {
    public enum Severity {
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        public static Severity fromAbsZScore(double absZ) {
            if (absZ >= 3.0) {
                return CRITICAL;
            }
            if (absZ >= 2.5) {
                return HIGH;
            }
            if (absZ >= 2.0) {
                return MEDIUM;
            }
            return LOW;
        }
    }

    public enum Kind {
        SPIKE,
        DROP
    }
}
