package com.phillippitts.anomalyguard.domain;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Versioned scoring model for one series.
 *
 * <p>The checksum is computed over the parameters, threshold and version when the model is
 * created through {@link #create}. A model whose stored checksum no longer matches is treated
 * as corrupt by the model store.
 *
 * @param seriesKey           series the model was trained for
 * @param version             monotonically increasing per series, starting at 1
 * @param trainedAt           when training finished
 * @param trainingWindowCount number of windows in the training corpus
 * @param parameters          algorithm-specific parameters
 * @param threshold           decision threshold in [0, 1]
 * @param checksum            integrity checksum
 */
public record TrainedModel(
        SeriesKey seriesKey,
        long version,
        Instant trainedAt,
        int trainingWindowCount,
        ModelParameters parameters,
        double threshold,
        long checksum
) {

    public TrainedModel {
        Objects.requireNonNull(seriesKey, "Series key must not be null");
        Objects.requireNonNull(trainedAt, "Training timestamp must not be null");
        Objects.requireNonNull(parameters, "Model parameters must not be null");
        if (version < 1) {
            throw new IllegalArgumentException("Model version must be >= 1, got: " + version);
        }
        if (trainingWindowCount < 0) {
            throw new IllegalArgumentException("Training window count must not be negative");
        }
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Threshold must be between 0.0 and 1.0, got: " + threshold);
        }
    }

    public static TrainedModel create(SeriesKey seriesKey, long version, Instant trainedAt,
                                      int trainingWindowCount, ModelParameters parameters, double threshold) {
        return new TrainedModel(seriesKey, version, trainedAt, trainingWindowCount, parameters, threshold,
                checksumOf(version, trainingWindowCount, parameters, threshold));
    }

    public String algorithm() {
        return parameters.algorithm();
    }

    public boolean verifyIntegrity() {
        return checksum == checksumOf(version, trainingWindowCount, parameters, threshold);
    }

    static long checksumOf(long version, int trainingWindowCount, ModelParameters parameters, double threshold) {
        double[] values = parameters.toArray();
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES + Integer.BYTES + Double.BYTES * (values.length + 1));
        buffer.putLong(version).putInt(trainingWindowCount).putDouble(threshold);
        for (double v : values) {
            buffer.putDouble(v);
        }
        CRC32 crc = new CRC32();
        crc.update(buffer.array());
        crc.update(parameters.algorithm().getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
