package org.broadinstitute.signatures.utils;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolver;
import org.apache.commons.math3.distribution.AbstractIntegerDistribution;
import org.apache.commons.math3.distribution.HypergeometricDistribution;

import java.util.Arrays;

/**
 * Implements the Fisher's exact test for 2x2 tables
 * against the null hypothesis of odds ratio 1.
 */
public final class FisherExactTest {
    private static final double DOUBLE_EPS = Math.ulp(1.0);
    private static final double SOLVER_ACCURACY = 1e-10;
    private static final int SOLVER_MAX_EVALUATIONS = 1000;

    private FisherExactTest() { }

    /**
     * One-sided Fisher's exact test with the alternative hypothesis that the true odds ratio is greater than 1.
     *
     * <p>
     * Reproduces R's {@code fisher.test(table, alternative = "greater")}: the p-value is P(X >= x) for the top-left
     * cell under the hypergeometric null, the estimate is the conditional maximum likelihood odds ratio and the
     * confidence interval is one-sided, {@code [lower, +Infinity]}.
     * </p>
     *
     * @param table 2x2 table of non-negative counts, {@code table[row][column]}
     * @param confidenceLevel confidence level of the interval, in (0, 1)
     */
    public static Result oneSidedGreater(final int[][] table, final double confidenceLevel) {
        validateTable(table);
        Utils.validateArg(confidenceLevel > 0 && confidenceLevel < 1, () -> "confidence level must be in (0, 1) but was " + confidenceLevel);
        return new NoncentralHypergeometric(table).testGreater(1 - confidenceLevel);
    }

    private static void validateTable(final int[][] table) {
        Utils.nonNull(table);
        Utils.validateArg(table.length == 2, () -> "input must be 2x2 " + Arrays.deepToString(table));
        Utils.validateArg(table[0] != null && table[0].length == 2, () -> "input must be 2x2 " + Arrays.deepToString(table));
        Utils.validateArg(table[1] != null && table[1].length == 2, () -> "input must be 2x2 " + Arrays.deepToString(table));
        for (final int[] row : table) {
            Utils.validateArg(row[0] >= 0 && row[1] >= 0, () -> "counts must be non-negative " + Arrays.deepToString(table));
        }
    }

    /**
     * Outcome of a one-sided test.
     */
    public static final class Result {
        private final double pValue;
        private final double oddsRatio;
        private final double confidenceIntervalLow;
        private final double confidenceIntervalHigh;

        public Result(final double pValue, final double oddsRatio, final double confidenceIntervalLow, final double confidenceIntervalHigh) {
            this.pValue = pValue;
            this.oddsRatio = oddsRatio;
            this.confidenceIntervalLow = confidenceIntervalLow;
            this.confidenceIntervalHigh = confidenceIntervalHigh;
        }

        public double getPValue() {
            return pValue;
        }

        /**
         * Conditional maximum likelihood estimate of the odds ratio; may be 0 or {@link Double#POSITIVE_INFINITY}.
         */
        public double getOddsRatio() {
            return oddsRatio;
        }

        public double getConfidenceIntervalLow() {
            return confidenceIntervalLow;
        }

        public double getConfidenceIntervalHigh() {
            return confidenceIntervalHigh;
        }

        @Override
        public String toString() {
            return "p=" + pValue + " or=" + oddsRatio + " ci=[" + confidenceIntervalLow + ", " + confidenceIntervalHigh + "]";
        }
    }

    /**
     * Distribution of the top-left cell given the table margins, parameterized by the odds ratio (ncp).
     */
    private static final class NoncentralHypergeometric {
        private final int x;
        private final int m;
        private final int n;
        private final int k;
        private final int lo;
        private final int hi;
        private final double[] logdc;

        NoncentralHypergeometric(final int[][] table) {
            x = table[0][0];
            m = table[0][0] + table[1][0];
            n = table[0][1] + table[1][1];
            k = table[0][0] + table[0][1];
            lo = Math.max(0, k - n);
            hi = Math.min(k, m);
            if (m + n > 0) {
                final AbstractIntegerDistribution dist = new HypergeometricDistribution(null, m + n, m, k);
                logdc = new IndexRange(lo, hi + 1).mapToDouble(dist::logProbability);
            } else {
                logdc = new double[]{0.0};
            }
        }

        Result testGreater(final double alpha) {
            return new Result(upperTail(x, 1.0), mle(), lowerConfidenceBound(alpha), Double.POSITIVE_INFINITY);
        }

        private double[] density(final double ncp) {
            final double logNcp = Math.log(ncp);
            final double[] d = new double[logdc.length];
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < d.length; i++) {
                d[i] = logdc[i] + logNcp * (lo + i);
                max = Math.max(max, d[i]);
            }
            double sum = 0;
            for (int i = 0; i < d.length; i++) {
                d[i] = Math.exp(d[i] - max);
                sum += d[i];
            }
            for (int i = 0; i < d.length; i++) {
                d[i] /= sum;
            }
            return d;
        }

        private double mean(final double ncp) {
            if (ncp == 0) {
                return lo;
            }
            if (Double.isInfinite(ncp)) {
                return hi;
            }
            final double[] d = density(ncp);
            double mean = 0;
            for (int i = 0; i < d.length; i++) {
                mean += (lo + i) * d[i];
            }
            return mean;
        }

        /**
         * P(X >= q) for the given odds ratio.
         */
        private double upperTail(final int q, final double ncp) {
            if (ncp == 1) {
                if (m + n == 0 || q <= lo) {
                    return 1.0;
                }
                final HypergeometricDistribution dist = new HypergeometricDistribution(null, m + n, m, k);
                return Math.max(0.0, Math.min(1.0, dist.upperCumulativeProbability(q)));
            }
            if (ncp == 0) {
                return q <= lo ? 1.0 : 0.0;
            }
            if (Double.isInfinite(ncp)) {
                return q <= hi ? 1.0 : 0.0;
            }
            final double[] d = density(ncp);
            double p = 0;
            for (int i = Math.max(0, q - lo); i < d.length; i++) {
                p += d[i];
            }
            return p;
        }

        private double mle() {
            if (x == lo) {
                return 0.0;
            }
            if (x == hi) {
                return Double.POSITIVE_INFINITY;
            }
            final double mu = mean(1.0);
            if (mu > x) {
                return solve(t -> mean(t) - x, 0, 1);
            } else if (mu < x) {
                return 1.0 / solve(t -> mean(1.0 / t) - x, DOUBLE_EPS, 1);
            }
            return 1.0;
        }

        private double lowerConfidenceBound(final double alpha) {
            if (x == lo) {
                return 0.0;
            }
            final double p = upperTail(x, 1.0);
            if (p > alpha) {
                return solve(t -> upperTail(x, t) - alpha, 0, 1);
            } else if (p < alpha) {
                return 1.0 / solve(t -> upperTail(x, 1.0 / t) - alpha, DOUBLE_EPS, 1);
            }
            return 1.0;
        }

        private static double solve(final UnivariateFunction f, final double min, final double max) {
            final UnivariateSolver solver = new BrentSolver(SOLVER_ACCURACY);
            return solver.solve(SOLVER_MAX_EVALUATIONS, f, min, max);
        }
    }
}
