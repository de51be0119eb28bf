package com.demandlens.insight.stats;

import com.demandlens.insight.exception.DegenerateInputException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Least squares through the normal equations.
 * <p>
 * {@code X'X} is rescaled to unit diagonal before the Cholesky solve, so the positivity
 * threshold reads as "a column is explained by the previous ones up to 1e-10" regardless
 * of the units of each regressor.
 */
public final class OrdinaryLeastSquares {

    static final double RELATIVE_PIVOT_THRESHOLD = 1e-10;
    private static final double SYMMETRY_THRESHOLD = 1e-12;

    public record Fit(double[] coefficients, double residualSumOfSquares, int observations) {
    }

    private OrdinaryLeastSquares() {
    }

    public static double residualSumOfSquares(double[][] design, double[] target) {
        return fit(design, target).residualSumOfSquares();
    }

    /**
     * @param design row-major design matrix, one row per observation
     * @param target observed responses, one per row
     */
    public static Fit fit(double[][] design, double[] target) {
        int n = target.length;
        if (design.length != n) {
            throw new InvalidParameterException("design has " + design.length + " rows but target has " + n);
        }
        if (n == 0) {
            throw new InsufficientDataException("least squares", 1, 0);
        }
        int k = design[0].length;
        for (double[] row : design) {
            if (row.length != k) {
                throw new InvalidParameterException("design rows must all have " + k + " columns");
            }
        }
        if (k == 0) {
            double ss = 0d;
            for (double value : target) {
                ss += value * value;
            }
            return new Fit(new double[0], ss, n);
        }
        if (n < k) {
            throw new InsufficientDataException("least squares with " + k + " regressors", k, n);
        }

        RealMatrix x = new Array2DRowRealMatrix(design, false);
        RealMatrix xtx = x.transpose().multiply(x);
        RealVector xty = x.transpose().operate(new ArrayRealVector(target, false));

        double[] scale = new double[k];
        for (int j = 0; j < k; j++) {
            double diagonal = xtx.getEntry(j, j);
            if (!(diagonal > 0d) || !Double.isFinite(diagonal)) {
                throw new DegenerateInputException("regressor " + j + " is identically zero");
            }
            scale[j] = 1d / Math.sqrt(diagonal);
        }
        RealMatrix scaled = xtx.copy();
        for (int i = 0; i < k; i++) {
            for (int j = 0; j < k; j++) {
                scaled.setEntry(i, j, xtx.getEntry(i, j) * scale[i] * scale[j]);
            }
        }
        RealVector scaledRhs = xty.copy();
        for (int i = 0; i < k; i++) {
            scaledRhs.setEntry(i, xty.getEntry(i) * scale[i]);
        }

        RealVector solution;
        try {
            CholeskyDecomposition cholesky = new CholeskyDecomposition(scaled, SYMMETRY_THRESHOLD, RELATIVE_PIVOT_THRESHOLD);
            solution = cholesky.getSolver().solve(scaledRhs);
        } catch (MathIllegalArgumentException ex) {
            throw new DegenerateInputException("normal equations are singular or near-singular", ex);
        }

        double[] beta = new double[k];
        for (int j = 0; j < k; j++) {
            beta[j] = solution.getEntry(j) * scale[j];
            if (!Double.isFinite(beta[j])) {
                throw new DegenerateInputException("least squares produced a non-finite coefficient");
            }
        }

        double rss = 0d;
        for (int t = 0; t < n; t++) {
            double predicted = 0d;
            for (int j = 0; j < k; j++) {
                predicted += beta[j] * design[t][j];
            }
            double residual = target[t] - predicted;
            rss += residual * residual;
        }
        return new Fit(beta, rss, n);
    }
}
