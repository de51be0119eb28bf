package com.demandlens.insight.model;

import java.util.List;

public record WindowedScanResult(
        String sourceId,
        String factorId,
        int windowDays,
        int stepDays,
        List<WindowedLagResult> windows,
        List<UnitFailure> failures
) {
    public WindowedScanResult {
        windows = List.copyOf(windows);
        failures = List.copyOf(failures);
    }
}
