package com.demandlens.insight.config;

import com.demandlens.insight.model.AnomalyOptions;
import com.demandlens.insight.model.Granularity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "insight")
public record InsightProperties(
        Correlation correlation,
        Windowing windowing,
        Granger granger,
        Anomaly anomaly,
        Executor executor
) {

    @ConstructorBinding
    public InsightProperties {
        // every block is optional; missing blocks fall back to defaults
        if (correlation == null) {
            correlation = new Correlation(null, null, null, null, null);
        }
        if (windowing == null) {
            windowing = new Windowing(null, null);
        }
        if (granger == null) {
            granger = new Granger(null, null);
        }
        if (anomaly == null) {
            anomaly = new Anomaly(null, null, null, null);
        }
        if (executor == null) {
            executor = new Executor(null);
        }
    }

    public static InsightProperties defaults() {
        return new InsightProperties(null, null, null, null, null);
    }

    public record Correlation(
            Integer minSamples,
            Double significance,
            Double strongThreshold,
            Double moderateThreshold,
            Integer defaultMaxLag
    ) {
        public Correlation {
            if (minSamples == null) {
                minSamples = 3;
            }
            if (minSamples < 3) {
                throw new IllegalArgumentException("minSamples must be at least 3");
            }
            significance = probability(significance, 0.05, "significance");
            if (strongThreshold == null) {
                strongThreshold = 0.5;
            }
            if (moderateThreshold == null) {
                moderateThreshold = 0.3;
            }
            if (moderateThreshold <= 0 || strongThreshold > 1 || moderateThreshold >= strongThreshold) {
                throw new IllegalArgumentException("thresholds must satisfy 0 < moderateThreshold < strongThreshold <= 1");
            }
            if (defaultMaxLag == null) {
                defaultMaxLag = 14;
            }
            if (defaultMaxLag < 0) {
                throw new IllegalArgumentException("defaultMaxLag must not be negative");
            }
        }
    }

    public record Windowing(Integer windowDays, Integer stepDays) {
        public Windowing {
            if (windowDays == null) {
                windowDays = 30;
            }
            if (stepDays == null) {
                stepDays = 7;
            }
            if (windowDays <= 0 || stepDays <= 0) {
                throw new IllegalArgumentException("windowDays and stepDays must be positive");
            }
        }
    }

    public record Granger(Integer defaultOrder, Double significance) {
        public Granger {
            if (defaultOrder == null) {
                defaultOrder = 2;
            }
            if (defaultOrder <= 0) {
                throw new IllegalArgumentException("defaultOrder must be positive");
            }
            significance = probability(significance, 0.05, "significance");
        }
    }

    public record Anomaly(
            Double threshold,
            Integer minPeriods,
            Granularity granularity,
            AnomalyOptions.Baseline baseline
    ) {
        public Anomaly {
            if (threshold == null) {
                threshold = AnomalyOptions.DEFAULT_THRESHOLD;
            }
            if (threshold <= 0) {
                throw new IllegalArgumentException("threshold must be positive");
            }
            if (minPeriods == null) {
                minPeriods = 3;
            }
            if (minPeriods < 2) {
                throw new IllegalArgumentException("minPeriods must be at least 2");
            }
            if (granularity == null) {
                granularity = Granularity.WEEKLY;
            }
            if (baseline == null) {
                baseline = AnomalyOptions.Baseline.GLOBAL;
            }
        }

        public AnomalyOptions toOptions() {
            return new AnomalyOptions(granularity, threshold, baseline, 0, null);
        }
    }

    public record Executor(Integer parallelism) {
        public Executor {
            if (parallelism == null) {
                parallelism = 4;
            }
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
        }
    }

    private static double probability(Double value, double fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0 || value >= 1) {
            throw new IllegalArgumentException(name + " must be in (0, 1)");
        }
        return value;
    }
}
