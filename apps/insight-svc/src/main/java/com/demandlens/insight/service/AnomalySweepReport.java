package com.demandlens.insight.service;

import com.demandlens.insight.model.AnomalyOptions;
import com.demandlens.insight.model.AnomalyRecord;
import com.demandlens.insight.model.UnitFailure;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anomalies per product, keyed in request order. Products that could not be evaluated
 * appear only in {@code failures}.
 */
public record AnomalySweepReport(
        LocalDate from,
        LocalDate to,
        AnomalyOptions options,
        Map<String, List<AnomalyRecord>> anomaliesByProduct,
        List<UnitFailure> failures
) {
    public AnomalySweepReport {
        anomaliesByProduct = Collections.unmodifiableMap(new LinkedHashMap<>(anomaliesByProduct));
        failures = List.copyOf(failures);
    }

    public List<AnomalyRecord> forProduct(String productId) {
        return anomaliesByProduct.getOrDefault(productId, List.of());
    }

    public int totalAnomalies() {
        return anomaliesByProduct.values().stream().mapToInt(List::size).sum();
    }
}
