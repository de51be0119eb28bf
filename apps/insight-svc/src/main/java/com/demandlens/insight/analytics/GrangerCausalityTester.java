package com.demandlens.insight.analytics;

import com.demandlens.insight.config.InsightProperties;
import com.demandlens.insight.exception.DegenerateInputException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.AlignedPairs;
import com.demandlens.insight.model.DateAlignedSeries;
import com.demandlens.insight.model.GrangerResult;
import com.demandlens.insight.series.SeriesAligner;
import com.demandlens.insight.stats.OrdinaryLeastSquares;
import com.demandlens.insight.stats.StatsPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bidirectional Granger F-test at a fixed lag order.
 * <p>
 * For an effect E and a candidate cause C over aligned rows t = p..N-1:
 * restricted {@code E_t ~ 1 + E_{t-1..t-p}}, unrestricted adds {@code C_{t-1..t-p}}, and
 * {@code F = ((RSS_r - RSS_u) / p) / (RSS_u / (n - 2p - 1))} with n = N - p rows.
 */
@Component
public class GrangerCausalityTester {

    private static final Logger log = LoggerFactory.getLogger(GrangerCausalityTester.class);

    // residuals below this share of the effect's variation count as an exact fit
    private static final double PERFECT_FIT_TOLERANCE = 1e-12;

    private final InsightProperties.Granger settings;

    public GrangerCausalityTester(InsightProperties properties) {
        this.settings = properties.granger();
    }

    public GrangerResult test(DateAlignedSeries a, DateAlignedSeries b) {
        return test(a, b, settings.defaultOrder());
    }

    /**
     * @param a candidate cause
     * @param b candidate effect
     */
    public GrangerResult test(DateAlignedSeries a, DateAlignedSeries b, int order) {
        if (order <= 0) {
            throw new InvalidParameterException("granger lag order must be positive: " + order);
        }
        AlignedPairs pairs = SeriesAligner.align(a, b, 0);
        int required = minimumPairs(order);
        if (pairs.size() < required) {
            throw new InsufficientDataException("granger test of order " + order, required, pairs.size());
        }

        double[] forward = directional(pairs.x(), pairs.y(), order);
        double[] backward = directional(pairs.y(), pairs.x(), order);
        GrangerResult.Direction direction = GrangerResult.Direction.classify(forward[1], backward[1], settings.significance());
        int rows = pairs.size() - order;
        log.debug("granger a={} b={} order={} rows={} pAB={} pBA={} direction={}",
                a.id(), b.id(), order, rows, forward[1], backward[1], direction);
        return new GrangerResult(a.id(), b.id(), order, rows, forward[0], forward[1], backward[0], backward[1], direction);
    }

    /**
     * Smallest pair count that keeps both the 2p+5 floor and a positive residual df.
     */
    static int minimumPairs(int order) {
        return Math.max(2 * order + 5, 3 * order + 2);
    }

    /**
     * @return {F, p} for "cause Granger-causes effect"
     */
    private static double[] directional(double[] cause, double[] effect, int order) {
        int total = effect.length;
        int rows = total - order;
        double[][] restricted = new double[rows][1 + order];
        double[][] unrestricted = new double[rows][1 + 2 * order];
        double[] target = new double[rows];
        for (int t = order; t < total; t++) {
            int row = t - order;
            target[row] = effect[t];
            restricted[row][0] = 1d;
            unrestricted[row][0] = 1d;
            for (int k = 1; k <= order; k++) {
                restricted[row][k] = effect[t - k];
                unrestricted[row][k] = effect[t - k];
                unrestricted[row][order + k] = cause[t - k];
            }
        }

        double rssRestricted = OrdinaryLeastSquares.residualSumOfSquares(restricted, target);
        double rssUnrestricted = OrdinaryLeastSquares.residualSumOfSquares(unrestricted, target);
        int df2 = rows - 2 * order - 1;
        if (df2 < 1) {
            throw new InsufficientDataException("granger test of order " + order, minimumPairs(order), total);
        }

        double scale = PERFECT_FIT_TOLERANCE * sumOfSquaredDeviations(target);
        boolean unrestrictedExact = rssUnrestricted <= scale;
        boolean restrictedExact = rssRestricted <= scale;
        if (unrestrictedExact && restrictedExact) {
            throw new DegenerateInputException("effect series is fully explained by its own lags; F statistic undefined");
        }
        if (unrestrictedExact) {
            return new double[] {Double.POSITIVE_INFINITY, 0d};
        }
        double f = ((rssRestricted - rssUnrestricted) / order) / (rssUnrestricted / df2);
        f = Math.max(0d, f);
        return new double[] {f, StatsPrimitives.fSurvival(f, order, df2)};
    }

    private static double sumOfSquaredDeviations(double[] values) {
        double mean = StatsPrimitives.mean(values);
        double ss = 0d;
        for (double value : values) {
            ss += (value - mean) * (value - mean);
        }
        return ss;
    }
}
