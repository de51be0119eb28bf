package com.demandlens.insight.model;

import java.util.List;
import java.util.Optional;

/**
 * Results of one lag scan, ranked by |r| descending (ties: smaller |lag| first).
 * Every ranked entry carries an FDR-adjusted p-value local to this scan.
 */
public record LagScanResult(
        String sourceId,
        String factorId,
        int maxLag,
        List<CorrelationResult> results,
        List<UnitFailure> skipped
) {
    public LagScanResult {
        results = List.copyOf(results);
        skipped = List.copyOf(skipped);
    }

    public Optional<CorrelationResult> best() {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<CorrelationResult> atLag(int lag) {
        return results.stream().filter(result -> result.lag() == lag).findFirst();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
