package com.demandlens.insight.service;

import com.demandlens.insight.model.CorrelationResult;
import com.demandlens.insight.model.LagScanResult;
import com.demandlens.insight.model.UnitFailure;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One lag scan per factor against a single target, in the order the factors were requested.
 */
public record FactorScanReport(
        String targetId,
        LocalDate from,
        LocalDate to,
        int maxLag,
        List<LagScanResult> scans,
        List<UnitFailure> failures
) {
    public static final int DEFAULT_TOP_FINDINGS = 3;
    public static final double DEFAULT_MIN_ABS_COEFFICIENT = 0.3d;

    public FactorScanReport {
        scans = List.copyOf(scans);
        failures = List.copyOf(failures);
    }

    public Optional<LagScanResult> forFactor(String factorId) {
        return scans.stream().filter(scan -> scan.factorId().equals(factorId)).findFirst();
    }

    /**
     * Best lag of each factor, kept when its adjusted p-value is below {@code alpha} or
     * |r| reaches {@code minAbsCoefficient}, strongest first.
     */
    public List<CorrelationResult> topFindings(int limit, double alpha, double minAbsCoefficient) {
        return scans.stream()
                .map(LagScanResult::best)
                .flatMap(Optional::stream)
                .filter(best -> best.significant(alpha) || best.absCoefficient() >= minAbsCoefficient)
                .sorted(Comparator.comparingDouble(CorrelationResult::absCoefficient).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public List<CorrelationResult> topFindings(double alpha) {
        return topFindings(DEFAULT_TOP_FINDINGS, alpha, DEFAULT_MIN_ABS_COEFFICIENT);
    }
}
