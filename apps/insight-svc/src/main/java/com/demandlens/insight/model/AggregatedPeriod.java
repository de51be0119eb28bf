package com.demandlens.insight.model;

import java.time.LocalDate;

public record AggregatedPeriod(
        String label,
        LocalDate startDate,
        LocalDate endDate,
        double value,
        int sourceCount
) {
}
