package com.phillippitts.anomalyguard.domain;

/**
 * Opaque trained parameters produced by a scoring algorithm.
 *
 * <p>Implementations must be immutable. {@link #toArray()} exposes a flat numeric form used for
 * integrity checksums; it must be deterministic for identical parameters.
 */
public interface ModelParameters {

    /**
     * @return name of the algorithm that produced (and can score with) these parameters
     */
    String algorithm();

    /**
     * @return flat copy of every numeric parameter, in a stable order
     */
    double[] toArray();
}
