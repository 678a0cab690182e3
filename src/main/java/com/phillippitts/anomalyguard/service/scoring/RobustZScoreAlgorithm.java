package com.phillippitts.anomalyguard.service.scoring;

import java.util.Arrays;

/**
 * Median and scaled median absolute deviation. Outliers already present in the training
 * history barely move either statistic.
 *
 * <p>MAD is zero whenever more than half of the values are equal, which is the normal shape of
 * a mostly idle metric. The spread then falls back to the scaled mean absolute deviation from
 * the median, so the occasional non-idle window still yields a usable scale.
 */
public class RobustZScoreAlgorithm extends AbstractZScoreAlgorithm {

    public static final String NAME = "robust-zscore";

    /** Makes MAD a consistent estimator of the standard deviation for normal data. */
    static final double MAD_TO_SIGMA = 1.4826;

    /** Same for mean absolute deviation: sqrt(pi / 2). */
    static final double MEAN_AD_TO_SIGMA = 1.2533;

    public RobustZScoreAlgorithm(int batchSize) {
        super(batchSize);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double center(double[] values) {
        return median(values.clone());
    }

    @Override
    protected double spread(double[] values, double center) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        double mad = median(deviations);
        if (mad > 0.0) {
            return mad * MAD_TO_SIGMA;
        }
        return meanAbsoluteDeviation(deviations) * MEAN_AD_TO_SIGMA;
    }

    private static double meanAbsoluteDeviation(double[] deviations) {
        double sum = 0.0;
        for (double d : deviations) {
            sum += d;
        }
        return deviations.length == 0 ? 0.0 : sum / deviations.length;
    }

    static double median(double[] values) {
        Arrays.sort(values);
        int mid = values.length / 2;
        if (values.length % 2 == 1) {
            return values[mid];
        }
        return (values[mid - 1] + values[mid]) / 2.0;
    }
}
