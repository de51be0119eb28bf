package com.demandlens.insight.service;

import com.demandlens.insight.analytics.AnomalyDetector;
import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.AnalysisException;
import com.demandlens.insight.model.AnomalyOptions;
import com.demandlens.insight.model.AnomalyRecord;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.UnitFailure;
import com.demandlens.insight.repository.SeriesProvider;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs anomaly detection for many products at once. One product failing never stops the others.
 */
@Service
public class AnomalySweepService {

    private static final Logger log = LoggerFactory.getLogger(AnomalySweepService.class);

    private final SeriesProvider seriesProvider;
    private final AnomalyDetector anomalyDetector;
    private final InsightProperties properties;
    private final Executor executor;

    public AnomalySweepService(
            SeriesProvider seriesProvider,
            AnomalyDetector anomalyDetector,
            InsightProperties properties,
            @Qualifier("analysisExecutor") Executor executor
    ) {
        this.seriesProvider = seriesProvider;
        this.anomalyDetector = anomalyDetector;
        this.properties = properties;
        this.executor = executor;
    }

    public AnomalySweepReport sweep(List<String> productIds, LocalDate from, LocalDate to) {
        return sweep(productIds, from, to, properties.anomaly().toOptions());
    }

    public AnomalySweepReport sweep(List<String> productIds, LocalDate from, LocalDate to, AnomalyOptions options) {
        FactorAnalysisService.requireRange(from, to);
        AnomalyOptions effective = options != null ? options : properties.anomaly().toOptions();

        List<CompletableFuture<ProductOutcome>> futures = productIds.stream()
                .map(productId -> CompletableFuture.supplyAsync(() -> detect(productId, from, to, effective), executor))
                .toList();

        Map<String, List<AnomalyRecord>> byProduct = new LinkedHashMap<>();
        List<UnitFailure> failures = new ArrayList<>();
        for (CompletableFuture<ProductOutcome> future : futures) {
            ProductOutcome outcome = future.join();
            if (outcome.failure() == null) {
                byProduct.put(outcome.productId(), outcome.anomalies());
            } else {
                failures.add(outcome.failure());
            }
        }
        int flagged = byProduct.values().stream().mapToInt(List::size).sum();
        log.info("anomaly_sweep products={} evaluated={} failed={} anomalies={} granularity={}",
                productIds.size(), byProduct.size(), failures.size(), flagged, effective.granularity());
        return new AnomalySweepReport(from, to, effective, byProduct, failures);
    }

    private ProductOutcome detect(String productId, LocalDate from, LocalDate to, AnomalyOptions options) {
        try {
            DateAlignedSeries series = seriesProvider.fetch(productId, from, to);
            List<AnomalyRecord> anomalies = anomalyDetector.detect(series, options.withGroupKey(productId));
            return new ProductOutcome(productId, anomalies, null);
        } catch (AnalysisException ex) {
            log.debug("product_skipped product={} kind={} reason={}", productId, ex.kind(), ex.getMessage());
            return new ProductOutcome(productId, List.of(), UnitFailure.of(productId, ex));
        } catch (RuntimeException ex) {
            log.warn("product_failed product={} error={}", productId, ex.toString(), ex);
            return new ProductOutcome(productId, List.of(), UnitFailure.unexpected(productId, ex));
        }
    }

    private record ProductOutcome(String productId, List<AnomalyRecord> anomalies, UnitFailure failure) {
    }
}
