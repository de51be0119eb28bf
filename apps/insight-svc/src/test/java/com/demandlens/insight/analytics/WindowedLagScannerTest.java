package com.demandlens.insight.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.AnalysisException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.CorrelationResult;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.WindowedLagResult;
import com.demandlens.insight.model.WindowedScanResult;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WindowedLagScannerTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private ExecutorService executor;
    private LagScanner lagScanner;
    private WindowedLagScanner scanner;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        lagScanner = new LagScanner(new CorrelationAnalyzer(InsightProperties.defaults()));
        scanner = new WindowedLagScanner(lagScanner, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void windowWiderThanSpanEqualsFullScan() {
        DateAlignedSeries x = noisy("x", 0, 50, 5);
        DateAlignedSeries y = noisy("y", 0, 50, 6);

        WindowedScanResult windowed = scanner.scan(x, y, 4, 365, 7);
        CorrelationResult full = lagScanner.scan(x, y, 4).best().orElseThrow();

        assertThat(windowed.windows()).hasSize(1);
        WindowedLagResult only = windowed.windows().get(0);
        assertThat(only.windowStart()).isEqualTo(START);
        assertThat(only.windowEnd()).isEqualTo(START.plusDays(49));
        assertThat(only.bestLag()).isEqualTo(full.lag());
        assertThat(only.coefficient()).isEqualTo(full.coefficient());
        assertThat(only.pValue()).isEqualTo(full.pValue());
        assertThat(only.adjustedPValue()).isEqualTo(full.adjustedPValue());
        assertThat(only.sampleSize()).isEqualTo(full.sampleSize());
    }

    @Test
    void surfacesLeadThatChangesOverTime() {
        Random random = new Random(99);
        double[] driver = new double[60];
        for (int i = 0; i < driver.length; i++) {
            driver[i] = 20 + 3 * random.nextGaussian();
        }
        Map<LocalDate, Double> response = new HashMap<>();
        for (int t = 1; t < 60; t++) {
            response.put(START.plusDays(t), t < 30 ? driver[t - 1] : driver[t - 3]);
        }
        DateAlignedSeries x = DateAlignedSeries.daily("promo", START, driver);
        DateAlignedSeries y = DateAlignedSeries.of("sales", response);

        WindowedScanResult result = scanner.scan(x, y, 5, 30, 30);

        assertThat(result.windows()).extracting(WindowedLagResult::bestLag).containsExactly(1, 3);
        assertThat(result.windows()).allSatisfy(window ->
                assertThat(window.coefficient()).isCloseTo(1.0, within(1e-9)));
        assertThat(result.windows().get(1).windowStart()).isEqualTo(START.plusDays(30));
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void spanCoversBothSeriesAndClipsLastWindow() {
        DateAlignedSeries x = noisy("x", 0, 70, 1);
        DateAlignedSeries y = noisy("y", 10, 70, 2);

        List<WindowedLagScanner.Window> windows = WindowedLagScanner.windows(x, y, 30, 20);

        assertThat(windows).extracting(WindowedLagScanner.Window::start)
                .containsExactly(START, START.plusDays(20), START.plusDays(40), START.plusDays(60));
        assertThat(windows.get(3).end()).isEqualTo(START.plusDays(79));
        assertThat(windows.get(2).end()).isEqualTo(START.plusDays(69));
    }

    @Test
    void windowWithoutUsableLagIsReportedAsFailure() {
        Map<LocalDate, Double> xs = new HashMap<>();
        Map<LocalDate, Double> ys = new HashMap<>();
        Random random = new Random(5);
        for (int i = 0; i < 30; i++) {
            xs.put(START.plusDays(i), random.nextGaussian());
            ys.put(START.plusDays(i), random.nextGaussian());
        }
        xs.put(START.plusDays(40), 1.0);
        ys.put(START.plusDays(40), 2.0);

        WindowedScanResult result = scanner.scan(DateAlignedSeries.of("x", xs), DateAlignedSeries.of("y", ys), 2, 30, 30);

        assertThat(result.windows()).hasSize(1);
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.kind()).isEqualTo(AnalysisException.ErrorKind.INSUFFICIENT_DATA);
            assertThat(failure.unit()).contains(START.plusDays(30).toString());
        });
    }

    @Test
    void rejectsInvalidArguments() {
        DateAlignedSeries x = noisy("x", 0, 10, 1);

        assertThatThrownBy(() -> scanner.scan(x, x, 1, 0, 7)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> scanner.scan(x, x, 1, 30, -1)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> scanner.scan(x, x, -2, 30, 7)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> scanner.scan(x, x, Integer.MAX_VALUE, 30, 7)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> scanner.scan(x, DateAlignedSeries.empty("y"), 1, 30, 7))
                .isInstanceOf(InsufficientDataException.class);
    }

    private DateAlignedSeries noisy(String id, int offsetDays, int days, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days];
        for (int i = 0; i < days; i++) {
            values[i] = 100 + 10 * random.nextGaussian();
        }
        return DateAlignedSeries.daily(id, START.plusDays(offsetDays), values);
    }
}
