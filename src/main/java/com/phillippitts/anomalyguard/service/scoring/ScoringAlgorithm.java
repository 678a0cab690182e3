package com.phillippitts.anomalyguard.service.scoring;

import com.phillippitts.anomalyguard.domain.FeatureVector;
import com.phillippitts.anomalyguard.domain.ModelParameters;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Pluggable model family used by the scorer and the retraining scheduler.
 *
 * <p>Implementations must be stateless and thread-safe: one instance trains models for many
 * series concurrently and scores on the pipeline pool at the same time.
 */
public interface ScoringAlgorithm {

    /**
     * @return identifier stored with every model this algorithm trains
     */
    String name();

    /**
     * Fits parameters to a training corpus.
     *
     * @param corpus    non-empty feature vectors of non-empty windows, oldest first
     * @param cancelled polled between batches; training stops once it returns true
     * @return fitted parameters
     * @throws com.phillippitts.anomalyguard.exception.TrainingFailureException if the corpus cannot
     *         produce a usable model
     * @throws com.phillippitts.anomalyguard.exception.TrainingCancelledException if cancelled
     */
    ModelParameters train(List<FeatureVector> corpus, BooleanSupplier cancelled);

    /**
     * @param parameters parameters previously returned by {@link #train}
     * @param vector     vector to score
     * @return anomaly score in [0, 1]
     */
    double score(ModelParameters parameters, FeatureVector vector);
}
