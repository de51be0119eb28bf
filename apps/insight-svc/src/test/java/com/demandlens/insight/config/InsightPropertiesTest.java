package com.demandlens.insight.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demandlens.insight.model.AnomalyOptions;
import com.demandlens.insight.model.Granularity;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class InsightPropertiesTest {

    @Test
    void missingBlocksFallBackToDefaults() {
        InsightProperties props = InsightProperties.defaults();

        assertThat(props.correlation().minSamples()).isEqualTo(3);
        assertThat(props.correlation().significance()).isEqualTo(0.05);
        assertThat(props.correlation().defaultMaxLag()).isEqualTo(14);
        assertThat(props.windowing().windowDays()).isEqualTo(30);
        assertThat(props.windowing().stepDays()).isEqualTo(7);
        assertThat(props.granger().defaultOrder()).isEqualTo(2);
        assertThat(props.anomaly().threshold()).isEqualTo(3.0);
        assertThat(props.anomaly().granularity()).isEqualTo(Granularity.WEEKLY);
        assertThat(props.anomaly().baseline()).isEqualTo(AnomalyOptions.Baseline.GLOBAL);
        assertThat(props.executor().parallelism()).isEqualTo(4);
    }

    @Test
    void bindsRelaxedNamesAndEnums() {
        Map<String, String> source = Map.of(
                "insight.correlation.min-samples", "5",
                "insight.correlation.strong-threshold", "0.7",
                "insight.anomaly.granularity", "monthly",
                "insight.anomaly.baseline", "trailing",
                "insight.executor.parallelism", "2");

        InsightProperties props = new Binder(new MapConfigurationPropertySource(source))
                .bind("insight", InsightProperties.class)
                .get();

        assertThat(props.correlation().minSamples()).isEqualTo(5);
        assertThat(props.correlation().strongThreshold()).isEqualTo(0.7);
        assertThat(props.correlation().moderateThreshold()).isEqualTo(0.3);
        assertThat(props.anomaly().granularity()).isEqualTo(Granularity.MONTHLY);
        assertThat(props.anomaly().toOptions().baseline()).isEqualTo(AnomalyOptions.Baseline.TRAILING);
        assertThat(props.windowing().windowDays()).isEqualTo(30);
        assertThat(props.executor().parallelism()).isEqualTo(2);
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new InsightProperties.Correlation(2, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightProperties.Correlation(null, 1.5, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightProperties.Correlation(null, null, 0.3, 0.5, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightProperties.Windowing(0, 7))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightProperties.Granger(0, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightProperties.Anomaly(-1.0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightProperties.Executor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
