package com.demandlens.insight.service;

import com.demandlens.insight.analytics.GrangerCausalityTester;
import com.demandlens.insight.analytics.LagScanner;
import com.demandlens.insight.analytics.WindowedLagScanner;
import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.AnalysisException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.AlignedPairs;
import com.demandlens.insight.model.CorrelationResult;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.GrangerResult;
import com.demandlens.insight.model.LagScanResult;
import com.demandlens.insight.model.RegressionResult;
import com.demandlens.insight.model.UnitFailure;
import com.demandlens.insight.model.WindowedScanResult;
import com.demandlens.insight.repository.SeriesProvider;
import com.demandlens.insight.series.SeriesAligner;
import com.demandlens.insight.stats.LinearRegression;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs factor-versus-target analyses over series pulled from a {@link SeriesProvider}.
 * In every result a positive lag means the factor leads the target.
 */
@Service
public class FactorAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FactorAnalysisService.class);

    private final SeriesProvider seriesProvider;
    private final LagScanner lagScanner;
    private final WindowedLagScanner windowedLagScanner;
    private final GrangerCausalityTester grangerCausalityTester;
    private final InsightProperties properties;
    private final Executor executor;

    public FactorAnalysisService(
            SeriesProvider seriesProvider,
            LagScanner lagScanner,
            WindowedLagScanner windowedLagScanner,
            GrangerCausalityTester grangerCausalityTester,
            InsightProperties properties,
            @Qualifier("analysisExecutor") Executor executor
    ) {
        this.seriesProvider = seriesProvider;
        this.lagScanner = lagScanner;
        this.windowedLagScanner = windowedLagScanner;
        this.grangerCausalityTester = grangerCausalityTester;
        this.properties = properties;
        this.executor = executor;
    }

    public FactorScanReport scanFactors(String targetId, List<String> factorIds, LocalDate from, LocalDate to) {
        return scanFactors(targetId, factorIds, from, to, properties.correlation().defaultMaxLag());
    }

    public FactorScanReport scanFactors(String targetId, List<String> factorIds, LocalDate from, LocalDate to, int maxLag) {
        requireRange(from, to);
        LagScanner.requireValidMaxLag(maxLag);
        DateAlignedSeries target = requireSeries(targetId, from, to);

        List<CompletableFuture<FactorOutcome>> futures = factorIds.stream()
                .map(factorId -> CompletableFuture.supplyAsync(() -> scanFactor(target, factorId, from, to, maxLag), executor))
                .toList();

        List<LagScanResult> scans = new ArrayList<>(factorIds.size());
        List<UnitFailure> failures = new ArrayList<>();
        for (CompletableFuture<FactorOutcome> future : futures) {
            FactorOutcome outcome = future.join();
            if (outcome.scan() != null) {
                scans.add(outcome.scan());
            } else {
                failures.add(outcome.failure());
            }
        }
        log.info("factor_scan target={} factors={} scanned={} failed={} maxLag={}",
                targetId, factorIds.size(), scans.size(), failures.size(), maxLag);
        return new FactorScanReport(targetId, from, to, maxLag, scans, failures);
    }

    public WindowedScanResult scanWindows(String targetId, String factorId, LocalDate from, LocalDate to, int maxLag) {
        InsightProperties.Windowing windowing = properties.windowing();
        return scanWindows(targetId, factorId, from, to, maxLag, windowing.windowDays(), windowing.stepDays());
    }

    public WindowedScanResult scanWindows(String targetId, String factorId, LocalDate from, LocalDate to,
                                          int maxLag, int windowDays, int stepDays) {
        requireRange(from, to);
        DateAlignedSeries target = requireSeries(targetId, from, to);
        DateAlignedSeries factor = requireSeries(factorId, from, to);
        WindowedScanResult scan = windowedLagScanner.scan(factor, target, maxLag, windowDays, stepDays);
        return new WindowedScanResult(targetId, factorId, windowDays, stepDays, scan.windows(), scan.failures());
    }

    public GrangerResult testCausality(String causeId, String effectId, LocalDate from, LocalDate to) {
        return testCausality(causeId, effectId, from, to, properties.granger().defaultOrder());
    }

    public GrangerResult testCausality(String causeId, String effectId, LocalDate from, LocalDate to, int order) {
        requireRange(from, to);
        DateAlignedSeries cause = seriesProvider.fetch(causeId, from, to);
        DateAlignedSeries effect = seriesProvider.fetch(effectId, from, to);
        GrangerResult result = grangerCausalityTester.test(cause, effect, order);
        log.info("granger_test cause={} effect={} order={} direction={}", causeId, effectId, order, result.direction());
        return result;
    }

    /**
     * Fits target against factor on dates both series share and evaluates the line at {@code predictAt}.
     */
    public RegressionResult regress(String factorId, String targetId, LocalDate from, LocalDate to, double predictAt) {
        requireRange(from, to);
        DateAlignedSeries factor = seriesProvider.fetch(factorId, from, to);
        DateAlignedSeries target = seriesProvider.fetch(targetId, from, to);
        AlignedPairs pairs = SeriesAligner.align(factor, target, 0);
        return LinearRegression.fit(pairs.x(), pairs.y(), predictAt);
    }

    private FactorOutcome scanFactor(DateAlignedSeries target, String factorId, LocalDate from, LocalDate to, int maxLag) {
        try {
            DateAlignedSeries factor = seriesProvider.fetch(factorId, from, to);
            LagScanResult scan = lagScanner.scan(factor, target, maxLag);
            if (scan.isEmpty()) {
                return new FactorOutcome(null, new UnitFailure(factorId, AnalysisException.ErrorKind.INSUFFICIENT_DATA,
                        "no lag produced a correlation (" + scan.skipped().size() + " skipped)"));
            }
            List<CorrelationResult> relabelled = scan.results().stream()
                    .map(result -> result.withFactor(factorId))
                    .toList();
            return new FactorOutcome(new LagScanResult(target.id(), factorId, maxLag, relabelled, scan.skipped()), null);
        } catch (AnalysisException ex) {
            log.debug("factor_skipped target={} factor={} kind={} reason={}", target.id(), factorId, ex.kind(), ex.getMessage());
            return new FactorOutcome(null, UnitFailure.of(factorId, ex));
        } catch (RuntimeException ex) {
            log.warn("factor_failed target={} factor={} error={}", target.id(), factorId, ex.toString(), ex);
            return new FactorOutcome(null, UnitFailure.unexpected(factorId, ex));
        }
    }

    private DateAlignedSeries requireSeries(String seriesId, LocalDate from, LocalDate to) {
        DateAlignedSeries series = seriesProvider.fetch(seriesId, from, to);
        if (series.isEmpty()) {
            throw new InsufficientDataException("series '" + seriesId + "' between " + from + " and " + to, 1, 0);
        }
        return series;
    }

    static void requireRange(LocalDate from, LocalDate to) {
        if (from == null || to == null || from.isAfter(to)) {
            throw new InvalidParameterException("invalid date range " + from + " .. " + to);
        }
    }

    private record FactorOutcome(LagScanResult scan, UnitFailure failure) {
    }
}
