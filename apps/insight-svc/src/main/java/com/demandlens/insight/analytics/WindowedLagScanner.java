package com.demandlens.insight.analytics;

import com.demandlens.insight.exception.AnalysisException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.LagScanResult;
import com.demandlens.insight.model.UnitFailure;
import com.demandlens.insight.model.WindowedLagResult;
import com.demandlens.insight.model.WindowedScanResult;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Re-runs the lag scan inside sliding calendar windows to expose lead/lag relationships
 * that only hold for part of the history.
 * <p>
 * The span runs from the earlier first date to the later last date of the two series.
 * Windows start at the span start, advance by {@code stepDays} and cover {@code windowDays}
 * calendar days; the last one is clipped at the span end.
 */
@Component
public class WindowedLagScanner {

    private static final Logger log = LoggerFactory.getLogger(WindowedLagScanner.class);

    private final LagScanner lagScanner;
    private final Executor executor;

    public WindowedLagScanner(LagScanner lagScanner, @Qualifier("analysisExecutor") Executor executor) {
        this.lagScanner = lagScanner;
        this.executor = executor;
    }

    public WindowedScanResult scan(DateAlignedSeries x, DateAlignedSeries y, int maxLag, int windowDays, int stepDays) {
        if (windowDays <= 0 || stepDays <= 0) {
            throw new InvalidParameterException("windowDays and stepDays must be positive (" + windowDays + ", " + stepDays + ")");
        }
        LagScanner.requireValidMaxLag(maxLag);
        if (x.isEmpty() || y.isEmpty()) {
            throw new InsufficientDataException("windowed lag scan", 1, Math.min(x.size(), y.size()));
        }

        List<Window> windows = windows(x, y, windowDays, stepDays);
        List<CompletableFuture<WindowOutcome>> futures = windows.stream()
                .map(window -> CompletableFuture.supplyAsync(() -> evaluate(window, x, y, maxLag), executor))
                .toList();

        List<WindowedLagResult> results = new ArrayList<>(windows.size());
        List<UnitFailure> failures = new ArrayList<>();
        for (CompletableFuture<WindowOutcome> future : futures) {
            WindowOutcome outcome = future.join();
            if (outcome.result() != null) {
                results.add(outcome.result());
            } else {
                failures.add(outcome.failure());
            }
        }
        log.info("windowed_lag_scan source={} factor={} windows={} dropped={} windowDays={} stepDays={}",
                x.id(), y.id(), results.size(), failures.size(), windowDays, stepDays);
        return new WindowedScanResult(x.id(), y.id(), windowDays, stepDays, results, failures);
    }

    static List<Window> windows(DateAlignedSeries x, DateAlignedSeries y, int windowDays, int stepDays) {
        LocalDate spanStart = min(x.firstDate(), y.firstDate());
        LocalDate spanEnd = max(x.lastDate(), y.lastDate());
        List<Window> windows = new ArrayList<>();
        LocalDate start = spanStart;
        while (true) {
            LocalDate end = min(start.plusDays(windowDays - 1L), spanEnd);
            windows.add(new Window(start, end));
            if (!end.isBefore(spanEnd)) {
                break;
            }
            start = start.plusDays(stepDays);
        }
        return windows;
    }

    private WindowOutcome evaluate(Window window, DateAlignedSeries x, DateAlignedSeries y, int maxLag) {
        String unit = "window " + window.start() + ".." + window.end();
        try {
            LagScanResult scan = lagScanner.scan(
                    x.between(window.start(), window.end()),
                    y.between(window.start(), window.end()),
                    maxLag);
            return scan.best()
                    .map(best -> new WindowOutcome(WindowedLagResult.from(window.start(), window.end(), best), null))
                    .orElseGet(() -> new WindowOutcome(null, new UnitFailure(unit,
                            AnalysisException.ErrorKind.INSUFFICIENT_DATA,
                            "no lag produced a correlation (" + scan.skipped().size() + " skipped)")));
        } catch (AnalysisException ex) {
            return new WindowOutcome(null, UnitFailure.of(unit, ex));
        } catch (RuntimeException ex) {
            log.warn("window_failed source={} factor={} window={} error={}", x.id(), y.id(), unit, ex.toString(), ex);
            return new WindowOutcome(null, UnitFailure.unexpected(unit, ex));
        }
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    record Window(LocalDate start, LocalDate end) {
    }

    private record WindowOutcome(WindowedLagResult result, UnitFailure failure) {
    }
}
