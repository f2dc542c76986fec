package com.weatherline.backend.correlation;

import java.util.List;

/**
 * Descriptive statistics and Pearson correlation significance.
 * Standard deviation uses the sample (n - 1) denominator.
 */
public final class Statistics {

    private static final double[] LANCZOS = {
            0.99999999999980993,
            676.5203681218851,
            -1259.1392167224028,
            771.32342877765313,
            -176.61502916214059,
            12.507343278686905,
            -0.13857109526572012,
            9.9843695780195716e-6,
            1.5056327351493116e-7
    };

    private static final double HALF_LOG_TWO_PI = 0.5 * Math.log(2 * Math.PI);
    private static final int MAX_ITERATIONS = 300;
    private static final double EPSILON = 1e-14;
    private static final double FP_MIN = 1e-300;
    private static final double Z_95 = 1.959963984540054;

    private Statistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public static double mean(List<Double> values) {
        return mean(toArray(values));
    }

    public static double standardDeviation(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquares = 0;
        for (double v : values) {
            double d = v - mean;
            sumSquares += d * d;
        }
        return Math.sqrt(sumSquares / (values.length - 1));
    }

    public static double standardDeviation(List<Double> values) {
        return standardDeviation(toArray(values));
    }

    /**
     * Pearson product-moment coefficient, or NaN when either series is constant
     * or the series have fewer than two points.
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("Series lengths differ: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        if (n < 2) {
            return Double.NaN;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxx = 0;
        double syy = 0;
        double sxy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        if (sxx == 0 || syy == 0) {
            return Double.NaN;
        }
        double r = sxy / Math.sqrt(sxx * syy);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Two-tailed p-value of the t-test for a correlation coefficient {@code r} over {@code n} samples.
     */
    public static double correlationPValue(double r, int n) {
        if (n < 3 || Double.isNaN(r)) {
            return 1.0;
        }
        double rSquared = r * r;
        if (rSquared >= 1.0) {
            return 0.0;
        }
        int df = n - 2;
        double tSquared = rSquared * df / (1.0 - rSquared);
        double p = regularizedIncompleteBeta(df / (df + tSquared), df / 2.0, 0.5);
        return Math.max(0.0, Math.min(1.0, p));
    }

    /**
     * 95% confidence interval of {@code r} via the Fisher z-transform.
     * Degenerates to {@code [r, r]} for {@code n <= 3} or a perfect correlation.
     */
    public static double[] correlationConfidenceInterval(double r, int n) {
        if (n <= 3 || Math.abs(r) >= 1.0) {
            return new double[] {r, r};
        }
        double z = 0.5 * Math.log((1 + r) / (1 - r));
        double se = 1.0 / Math.sqrt(n - 3);
        return new double[] {Math.tanh(z - Z_95 * se), Math.tanh(z + Z_95 * se)};
    }

    public static double logGamma(double x) {
        if (x <= 0) {
            throw new IllegalArgumentException("logGamma requires x > 0, got " + x);
        }
        if (x < 0.5) {
            // Reflection
            return Math.log(Math.PI / Math.abs(Math.sin(Math.PI * x))) - logGamma(1 - x);
        }
        double xm1 = x - 1;
        double a = LANCZOS[0];
        double t = xm1 + 7.5;
        for (int i = 1; i < LANCZOS.length; i++) {
            a += LANCZOS[i] / (xm1 + i);
        }
        return HALF_LOG_TWO_PI + (xm1 + 0.5) * Math.log(t) - t + Math.log(a);
    }

    /**
     * Regularized incomplete beta function I_x(a, b).
     */
    public static double regularizedIncompleteBeta(double x, double a, double b) {
        if (x <= 0) {
            return 0.0;
        }
        if (x >= 1) {
            return 1.0;
        }
        double logFront = logGamma(a + b) - logGamma(a) - logGamma(b)
                + a * Math.log(x) + b * Math.log(1 - x);
        double front = Math.exp(logFront);
        if (x < (a + 1) / (a + b + 2)) {
            return front * betaContinuedFraction(x, a, b) / a;
        }
        return 1.0 - front * betaContinuedFraction(1 - x, b, a) / b;
    }

    private static double betaContinuedFraction(double x, double a, double b) {
        double qab = a + b;
        double qap = a + 1;
        double qam = a - 1;
        double c = 1.0;
        double d = 1.0 - qab * x / qap;
        if (Math.abs(d) < FP_MIN) {
            d = FP_MIN;
        }
        d = 1.0 / d;
        double h = d;
        for (int m = 1; m <= MAX_ITERATIONS; m++) {
            int m2 = 2 * m;
            double aa = m * (b - m) * x / ((qam + m2) * (a + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < FP_MIN) {
                d = FP_MIN;
            }
            c = 1.0 + aa / c;
            if (Math.abs(c) < FP_MIN) {
                c = FP_MIN;
            }
            d = 1.0 / d;
            h *= d * c;

            aa = -(a + m) * (qab + m) * x / ((a + m2) * (qap + m2));
            d = 1.0 + aa * d;
            if (Math.abs(d) < FP_MIN) {
                d = FP_MIN;
            }
            c = 1.0 + aa / c;
            if (Math.abs(c) < FP_MIN) {
                c = FP_MIN;
            }
            d = 1.0 / d;
            double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) {
                break;
            }
        }
        return h;
    }

    static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }
}
