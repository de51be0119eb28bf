package com.demandlens.insight.stats;

import com.demandlens.insight.exception.DegenerateInputException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Numerical building blocks shared by every analyzer.
 * <p>
 * Distribution tails are evaluated through the regularized incomplete beta function
 * (continued-fraction expansion over a Lanczos log-gamma, as provided by Commons Math).
 */
public final class StatsPrimitives {

    public static final int MIN_PEARSON_SAMPLES = 3;

    private StatsPrimitives() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            throw new InsufficientDataException("mean", 1, 0);
        }
        return StatUtils.mean(values);
    }

    /**
     * Sample standard deviation (n - 1 denominator). Fewer than two values give 0.
     */
    public static double stddev(double[] values) {
        if (values.length < 2) {
            return 0d;
        }
        return Math.sqrt(StatUtils.variance(values));
    }

    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new InvalidParameterException("pearson requires equal-length inputs (" + x.length + " vs " + y.length + ")");
        }
        if (x.length < MIN_PEARSON_SAMPLES) {
            throw new InsufficientDataException("pearson", MIN_PEARSON_SAMPLES, x.length);
        }
        if (StatUtils.variance(x) == 0d || StatUtils.variance(y) == 0d) {
            throw new DegenerateInputException("pearson undefined for zero-variance input");
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        if (Double.isNaN(r)) {
            throw new DegenerateInputException("pearson produced NaN");
        }
        return Math.max(-1d, Math.min(1d, r));
    }

    /**
     * Student-t CDF via {@code I_{df/(df+t^2)}(df/2, 1/2)}.
     */
    public static double studentTCdf(double t, double df) {
        if (!(df > 0)) {
            throw new InvalidParameterException("degrees of freedom must be positive: " + df);
        }
        if (t == 0d) {
            return 0.5d;
        }
        double tail = 0.5d * Beta.regularizedBeta(df / (df + t * t), 0.5d * df, 0.5d);
        return t > 0 ? 1d - tail : tail;
    }

    /**
     * Two-sided p-value of a Pearson coefficient {@code r} over {@code n} pairs.
     * Equal to {@code 2 * (1 - studentTCdf(|t|, n - 2))}; the tail is evaluated directly
     * to avoid cancellation for tiny p-values.
     */
    public static double studentTPValue(double r, int n) {
        if (n < MIN_PEARSON_SAMPLES) {
            throw new InsufficientDataException("t-test of correlation", MIN_PEARSON_SAMPLES, n);
        }
        if (Double.isNaN(r)) {
            throw new DegenerateInputException("correlation coefficient is NaN");
        }
        double oneMinusR2 = 1d - r * r;
        if (oneMinusR2 <= 0d) {
            return 0d;
        }
        double df = n - 2;
        double t = r * Math.sqrt(df / oneMinusR2);
        double p = Beta.regularizedBeta(df / (df + t * t), 0.5d * df, 0.5d);
        return clampProbability(p);
    }

    /**
     * P(F > f) for F ~ F(df1, df2).
     */
    public static double fSurvival(double f, double df1, double df2) {
        if (!(df1 > 0) || !(df2 > 0)) {
            throw new InvalidParameterException("F distribution degrees of freedom must be positive: " + df1 + ", " + df2);
        }
        if (Double.isNaN(f)) {
            throw new DegenerateInputException("F statistic is NaN");
        }
        if (f <= 0d) {
            return 1d;
        }
        if (Double.isInfinite(f)) {
            return 0d;
        }
        return clampProbability(Beta.regularizedBeta(df2 / (df2 + df1 * f), 0.5d * df2, 0.5d * df1));
    }

    /**
     * Benjamini-Hochberg step-up adjustment. Output is in the input order, capped at 1,
     * never below the raw value and monotone in the raw p-value.
     */
    public static double[] benjaminiHochberg(double[] pValues) {
        int m = pValues.length;
        double[] adjusted = new double[m];
        if (m == 0) {
            return adjusted;
        }
        Integer[] order = IntStream.range(0, m).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> pValues[i]));
        double running = 1d;
        for (int rank = m; rank >= 1; rank--) {
            int index = order[rank - 1];
            double candidate = pValues[index] * m / rank;
            running = Math.min(running, candidate);
            adjusted[index] = Math.min(1d, running);
        }
        return adjusted;
    }

    public static double[] firstDifference(double[] values) {
        if (values.length < 2) {
            return new double[0];
        }
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }

    /**
     * Residuals of an OLS fit against the time index 1..n.
     */
    public static double[] detrend(double[] values) {
        if (values.length < 2) {
            return values.clone();
        }
        SimpleRegression trend = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            trend.addData(i + 1, values[i]);
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - trend.predict(i + 1);
        }
        return out;
    }

    private static double clampProbability(double p) {
        if (p < 0d) {
            return 0d;
        }
        return Math.min(1d, p);
    }
}
