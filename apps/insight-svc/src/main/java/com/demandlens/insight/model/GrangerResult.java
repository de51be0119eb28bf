package com.demandlens.insight.model;

/**
 * Bidirectional Granger F-test between a candidate cause A and a candidate effect B.
 */
public record GrangerResult(
        String seriesA,
        String seriesB,
        int order,
        int sampleSize,
        double fStatisticAToB,
        double pValueAToB,
        double fStatisticBToA,
        double pValueBToA,
        Direction direction
) {
    public enum Direction {
        NONE,
        A_TO_B,
        B_TO_A,
        BIDIRECTIONAL;

        public static Direction classify(double pValueAToB, double pValueBToA, double alpha) {
            boolean aToB = pValueAToB < alpha;
            boolean bToA = pValueBToA < alpha;
            if (aToB && bToA) {
                return BIDIRECTIONAL;
            }
            if (aToB) {
                return A_TO_B;
            }
            if (bToA) {
                return B_TO_A;
            }
            return NONE;
        }
    }
}
