package com.weatherline.backend.prediction;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordinary least squares on standardized features. Feature importance is each feature's
 * share of the summed absolute standardized coefficients; constant features get zero.
 */
@Component
public class LeastSquaresPredictorFitter implements PredictorFitter {

    // Keeps the normal equations solvable when features are collinear
    private static final double RIDGE = 1e-9;

    @Override
    public FittedPredictor fit(String targetName, List<String> featureNames, double[][] features, double[] targets) {
        int n = targets.length;
        int p = featureNames.size();
        if (features.length != n) {
            throw new IllegalArgumentException("Feature rows (" + features.length + ") and targets (" + n + ") differ");
        }
        if (n < p + 2) {
            throw new IllegalArgumentException("Need at least " + (p + 2) + " samples to fit " + p + " features, got " + n);
        }

        double[] means = new double[p];
        double[] stds = new double[p];
        for (int j = 0; j < p; j++) {
            double sum = 0;
            for (double[] row : features) {
                if (row.length != p) {
                    throw new IllegalArgumentException("Feature row has " + row.length + " columns, expected " + p);
                }
                sum += row[j];
            }
            means[j] = sum / n;
            double ss = 0;
            for (double[] row : features) {
                double d = row[j] - means[j];
                ss += d * d;
            }
            stds[j] = Math.sqrt(ss / n);
        }

        double targetMean = 0;
        for (double t : targets) {
            targetMean += t;
        }
        targetMean /= n;

        double[][] z = new double[n][p];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                z[i][j] = stds[j] > 0 ? (features[i][j] - means[j]) / stds[j] : 0.0;
            }
        }

        double[][] gram = new double[p][p];
        double[] moment = new double[p];
        for (int i = 0; i < n; i++) {
            double centered = targets[i] - targetMean;
            for (int j = 0; j < p; j++) {
                moment[j] += z[i][j] * centered;
                for (int k = 0; k < p; k++) {
                    gram[j][k] += z[i][j] * z[i][k];
                }
            }
        }
        for (int j = 0; j < p; j++) {
            gram[j][j] += RIDGE;
            if (stds[j] == 0) {
                // Pin constant features to zero
                gram[j][j] = 1.0;
                moment[j] = 0.0;
            }
        }

        double[] standardized = solve(gram, moment);

        double[] coefficients = new double[p];
        double intercept = targetMean;
        for (int j = 0; j < p; j++) {
            coefficients[j] = stds[j] > 0 ? standardized[j] / stds[j] : 0.0;
            intercept -= coefficients[j] * means[j];
        }

        double absErr = 0;
        double sqErr = 0;
        double totalSq = 0;
        for (int i = 0; i < n; i++) {
            double predicted = intercept;
            for (int j = 0; j < p; j++) {
                predicted += coefficients[j] * features[i][j];
            }
            double residual = targets[i] - predicted;
            absErr += Math.abs(residual);
            sqErr += residual * residual;
            double dev = targets[i] - targetMean;
            totalSq += dev * dev;
        }
        double rSquared = totalSq > 0 ? 1.0 - sqErr / totalSq : 0.0;

        double importanceTotal = 0;
        for (double b : standardized) {
            importanceTotal += Math.abs(b);
        }
        Map<String, Double> importance = new LinkedHashMap<>();
        String mostImportant = featureNames.isEmpty() ? null : featureNames.get(0);
        double best = -1;
        for (int j = 0; j < p; j++) {
            double share = importanceTotal > 0 ? Math.abs(standardized[j]) / importanceTotal : 0.0;
            importance.put(featureNames.get(j), share);
            if (share > best) {
                best = share;
                mostImportant = featureNames.get(j);
            }
        }

        return new FittedPredictor(targetName, List.copyOf(featureNames), coefficients, intercept, n,
                absErr / n, Math.sqrt(sqErr / n), rSquared, importance, mostImportant);
    }

    /**
     * Gaussian elimination with partial pivoting.
     */
    static double[] solve(double[][] matrix, double[] rhs) {
        int size = rhs.length;
        double[][] a = new double[size][];
        for (int i = 0; i < size; i++) {
            a[i] = matrix[i].clone();
        }
        double[] b = rhs.clone();

        for (int col = 0; col < size; col++) {
            int pivot = col;
            for (int row = col + 1; row < size; row++) {
                if (Math.abs(a[row][col]) > Math.abs(a[pivot][col])) {
                    pivot = row;
                }
            }
            if (Math.abs(a[pivot][col]) < 1e-15) {
                throw new IllegalArgumentException("Singular system at column " + col);
            }
            double[] tmpRow = a[col];
            a[col] = a[pivot];
            a[pivot] = tmpRow;
            double tmp = b[col];
            b[col] = b[pivot];
            b[pivot] = tmp;

            for (int row = col + 1; row < size; row++) {
                double factor = a[row][col] / a[col][col];
                b[row] -= factor * b[col];
                for (int k = col; k < size; k++) {
                    a[row][k] -= factor * a[col][k];
                }
            }
        }

        double[] x = new double[size];
        for (int row = size - 1; row >= 0; row--) {
            double sum = b[row];
            for (int k = row + 1; k < size; k++) {
                sum -= a[row][k] * x[k];
            }
            x[row] = sum / a[row][row];
        }
        return x;
    }
}
