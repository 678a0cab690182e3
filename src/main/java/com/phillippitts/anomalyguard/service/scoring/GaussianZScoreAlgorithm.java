package com.phillippitts.anomalyguard.service.scoring;

/**
 * Mean and population standard deviation.
 */
public class GaussianZScoreAlgorithm extends AbstractZScoreAlgorithm {

    public static final String NAME = "gaussian-zscore";

    public GaussianZScoreAlgorithm(int batchSize) {
        super(batchSize);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double center(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    @Override
    protected double spread(double[] values, double center) {
        double squares = 0.0;
        for (double v : values) {
            double d = v - center;
            squares += d * d;
        }
        return Math.sqrt(squares / values.length);
    }
}
