/**
 * Immutable domain types of the anomaly pipeline.
 *
 * <p>Records flow leaf-first through the pipeline:
 * {@link com.phillippitts.anomalyguard.domain.TelemetryRecord} →
 * {@link com.phillippitts.anomalyguard.domain.SealedWindow} →
 * {@link com.phillippitts.anomalyguard.domain.FeatureVector} →
 * {@link com.phillippitts.anomalyguard.domain.ScoreResult} →
 * {@link com.phillippitts.anomalyguard.domain.Alert}.
 *
 * <p>All types validate their invariants in their constructors and are safe to share across
 * threads.
 */
package com.phillippitts.anomalyguard.domain;
