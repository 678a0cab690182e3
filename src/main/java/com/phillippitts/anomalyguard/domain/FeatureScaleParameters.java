package com.phillippitts.anomalyguard.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-feature location and scale learned from a training corpus.
 *
 * <p>Shared by the z-score style algorithms: each feature {@code i} is standardized as
 * {@code (x[i] - centers[i]) / scales[i]}. Scales are strictly positive.
 */
public final class FeatureScaleParameters implements ModelParameters {

    private final String algorithm;
    private final double[] centers;
    private final double[] scales;

    public FeatureScaleParameters(String algorithm, double[] centers, double[] scales) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(centers, "centers");
        Objects.requireNonNull(scales, "scales");
        if (centers.length != FeatureVector.LENGTH || scales.length != FeatureVector.LENGTH) {
            throw new IllegalArgumentException("Parameters must cover " + FeatureVector.LENGTH + " features");
        }
        for (int i = 0; i < scales.length; i++) {
            if (!Double.isFinite(centers[i]) || !Double.isFinite(scales[i]) || scales[i] <= 0.0) {
                throw new IllegalArgumentException("Invalid parameters for feature "
                        + FeatureVector.FEATURE_NAMES.get(i));
            }
        }
        this.centers = centers.clone();
        this.scales = scales.clone();
    }

    @Override
    public String algorithm() {
        return algorithm;
    }

    public double center(int feature) {
        return centers[feature];
    }

    public double scale(int feature) {
        return scales[feature];
    }

    @Override
    public double[] toArray() {
        double[] out = new double[centers.length * 2];
        System.arraycopy(centers, 0, out, 0, centers.length);
        System.arraycopy(scales, 0, out, centers.length, scales.length);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureScaleParameters other)) {
            return false;
        }
        return algorithm.equals(other.algorithm)
                && Arrays.equals(centers, other.centers)
                && Arrays.equals(scales, other.scales);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * algorithm.hashCode() + Arrays.hashCode(centers)) + Arrays.hashCode(scales);
    }

    @Override
    public String toString() {
        return algorithm + "[centers=" + Arrays.toString(centers) + ", scales=" + Arrays.toString(scales) + ']';
    }
}
