package com.demandlens.insight.stats;

import com.demandlens.insight.exception.DegenerateInputException;
import com.demandlens.insight.exception.InsufficientDataException;
import com.demandlens.insight.exception.InvalidParameterException;
import com.demandlens.insight.model.RegressionResult;
import java.util.Locale;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.SimpleRegression;

public final class LinearRegression {

    private LinearRegression() {
    }

    /**
     * Fits {@code y = slope * x + intercept} and evaluates it at {@code predictAt}.
     */
    public static RegressionResult fit(double[] x, double[] y, double predictAt) {
        if (x.length != y.length) {
            throw new InvalidParameterException("regression requires equal-length inputs (" + x.length + " vs " + y.length + ")");
        }
        if (x.length < 2) {
            throw new InsufficientDataException("linear regression", 2, x.length);
        }
        if (StatUtils.variance(x) == 0d) {
            throw new DegenerateInputException("regression undefined when every x is identical");
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            regression.addData(x[i], y[i]);
        }
        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        // constant y: the flat line fits exactly
        double rSquared = regression.getTotalSumSquares() == 0d ? 1d : regression.getRSquare();
        double prediction = slope * predictAt + intercept;
        String description = String.format(Locale.ROOT, "y = %.2fx %s %.2f (R² = %.3f)",
                slope, intercept < 0 ? "-" : "+", Math.abs(intercept), rSquared);
        return new RegressionResult(slope, intercept, rSquared, predictAt, prediction, x.length, description);
    }
}
