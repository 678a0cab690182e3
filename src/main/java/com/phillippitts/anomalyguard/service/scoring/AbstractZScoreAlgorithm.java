package com.phillippitts.anomalyguard.service.scoring;

import com.phillippitts.anomalyguard.domain.FeatureScaleParameters;
import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.ModelParameters;
import com.phillippitts.anomalyguard.exception.TrainingCancelledException;
import com.phillippitts.anomalyguard.exception.TrainingFailureException;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Template for algorithms that standardize each feature by a learned center and scale.
 *
 * <p>Subclasses supply the two statistics via {@link #center(double[])} and
 * {@link #spread(double[], double)}. Scoring takes the largest absolute standardized deviation
 * across features and maps it to [0, 1] with {@code 1 - exp(-z / 3)}, so a three-sigma
 * deviation scores about 0.63 and the score grows monotonically with the deviation.
 *
 * <p>A feature with no spread in the corpus (a perfectly steady metric) gets a floor scale
 * relative to its center, so later deviations still register without dividing by zero. A corpus
 * in which no feature varies at all is rejected.
 */
public abstract class AbstractZScoreAlgorithm implements ScoringAlgorithm {

    static final double Z_SCALE = 3.0;
    static final double RELATIVE_SCALE_FLOOR = 0.01;
    static final double ABSOLUTE_SCALE_FLOOR = 1e-6;

    private final int batchSize;

    protected AbstractZScoreAlgorithm(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
    }

    @Override
    public final ModelParameters train(List<FeatureVector> corpus, BooleanSupplier cancelled) {
        if (corpus == null || corpus.isEmpty()) {
            throw new TrainingFailureException("Training corpus is empty", "empty_corpus");
        }
        int n = corpus.size();
        double[][] columns = new double[FeatureVector.LENGTH][n];
        for (int row = 0; row < n; row++) {
            if (row % batchSize == 0) {
                checkCancelled(cancelled);
            }
            FeatureVector vector = corpus.get(row);
            if (vector.empty()) {
                throw new TrainingFailureException("Training corpus contains an empty window", "invalid_corpus");
            }
            for (int f = 0; f < FeatureVector.LENGTH; f++) {
                double value = vector.get(f);
                if (!Double.isFinite(value)) {
                    throw new TrainingFailureException("Non-finite " + FeatureVector.FEATURE_NAMES.get(f)
                            + " in window " + vector.windowId(), "non_finite");
                }
                columns[f][row] = value;
            }
        }

        double[] centers = new double[FeatureVector.LENGTH];
        double[] scales = new double[FeatureVector.LENGTH];
        boolean anySpread = false;
        for (int f = 0; f < FeatureVector.LENGTH; f++) {
            checkCancelled(cancelled);
            centers[f] = center(columns[f]);
            double spread = spread(columns[f], centers[f]);
            anySpread |= spread > 0.0;
            scales[f] = floorScale(spread, centers[f]);
            if (!Double.isFinite(centers[f]) || !Double.isFinite(scales[f])) {
                throw new TrainingFailureException("Non-finite statistics for "
                        + FeatureVector.FEATURE_NAMES.get(f), "non_finite");
            }
        }
        if (!anySpread) {
            throw new TrainingFailureException("No feature varies across the " + n + " training windows",
                    "no_variance");
        }
        return new FeatureScaleParameters(name(), centers, scales);
    }

    @Override
    public final double score(ModelParameters parameters, FeatureVector vector) {
        if (!(parameters instanceof FeatureScaleParameters scale)) {
            throw new IllegalArgumentException(name() + " cannot score with " + parameters.algorithm() + " parameters");
        }
        double maxZ = 0.0;
        for (int f = 0; f < FeatureVector.LENGTH; f++) {
            double z = Math.abs(vector.get(f) - scale.center(f)) / scale.scale(f);
            maxZ = Math.max(maxZ, z);
        }
        return toScore(maxZ);
    }

    /** Maps a non-negative deviation to [0, 1). */
    public static double toScore(double z) {
        if (!(z > 0.0)) {
            return 0.0;
        }
        if (Double.isInfinite(z)) {
            return 1.0;
        }
        return 1.0 - Math.exp(-z / Z_SCALE);
    }

    static double floorScale(double spread, double center) {
        double floor = Math.max(Math.abs(center) * RELATIVE_SCALE_FLOOR, ABSOLUTE_SCALE_FLOOR);
        return Math.max(spread, floor);
    }

    /**
     * @param values one feature across the corpus, in corpus order (may be reordered)
     */
    protected abstract double center(double[] values);

    /**
     * @param values one feature across the corpus (may be reordered)
     * @param center value returned by {@link #center(double[])}
     */
    protected abstract double spread(double[] values, double center);

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled != null && cancelled.getAsBoolean()) {
            throw new TrainingCancelledException("Training cancelled");
        }
    }
}
