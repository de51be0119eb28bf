package com.demandlens.insight.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.demandlens.insight.analytics.AnomalyDetector;
import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.AnalysisException;
import com.demandlens.insight.model.AnomalyOptions;
import com.demandlens.insight.model.AnomalyRecord;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.Granularity;
import com.demandlens.insight.model.UnitFailure;
import com.demandlens.insight.repository.InMemorySeriesProvider;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnomalySweepServiceTest {

    private static final LocalDate FROM = LocalDate.of(2024, 1, 1);
    private static final LocalDate TO = LocalDate.of(2024, 1, 31);

    private InMemorySeriesProvider seriesProvider;

    private AnomalySweepService service;

    @BeforeEach
    void setUp() {
        seriesProvider = new InMemorySeriesProvider();
        InsightProperties properties = InsightProperties.defaults();
        service = new AnomalySweepService(seriesProvider, new AnomalyDetector(properties), properties, Runnable::run);
    }

    @Test
    void sweepsProductsIndependently() {
        double[] spiky = new double[30];
        Arrays.fill(spiky, 100);
        spiky[29] = 500;
        double[] flat = new double[30];
        Arrays.fill(flat, 100);
        seriesProvider.save(DateAlignedSeries.daily("sku-spiky", FROM, spiky));
        seriesProvider.save(DateAlignedSeries.daily("sku-flat", FROM, flat));
        seriesProvider.save(DateAlignedSeries.daily("sku-new", FROM, 4, 5));

        AnomalySweepReport report = service.sweep(
                List.of("sku-spiky", "sku-flat", "sku-new", "sku-gone"), FROM, TO, AnomalyOptions.of(Granularity.DAILY));

        assertThat(report.anomaliesByProduct()).containsOnlyKeys("sku-spiky", "sku-flat");
        assertThat(report.forProduct("sku-flat")).isEmpty();
        assertThat(report.forProduct("sku-spiky")).singleElement().satisfies(anomaly -> {
            assertThat(anomaly.groupKey()).isEqualTo("sku-spiky");
            assertThat(anomaly.severity()).isEqualTo(AnomalyRecord.Severity.CRITICAL);
            assertThat(anomaly.kind()).isEqualTo(AnomalyRecord.Kind.SPIKE);
        });
        assertThat(report.totalAnomalies()).isEqualTo(1);
        assertThat(report.failures()).extracting(UnitFailure::unit).containsExactly("sku-new", "sku-gone");
        assertThat(report.failures()).extracting(UnitFailure::kind)
                .containsOnly(AnalysisException.ErrorKind.INSUFFICIENT_DATA);
    }

    @Test
    void fallsBackToConfiguredOptions() {
        double[] values = new double[31];
        Arrays.fill(values, 10);
        seriesProvider.save(DateAlignedSeries.daily("sku-1", FROM, values));

        AnomalySweepReport report = service.sweep(List.of("sku-1"), FROM, TO);

        assertThat(report.options().granularity()).isEqualTo(Granularity.WEEKLY);
        assertThat(report.options().threshold()).isEqualTo(3.0);
        assertThat(report.forProduct("sku-1")).isEmpty();
        assertThat(report.failures()).isEmpty();
    }
}
