/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.anomalyguard.exception.AnomalyGuardException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.anomalyguard.exception.OutOfOrderRejectedException} - record older
 *       than the seal boundary minus the grace period (dropped, counted)</li>
 *   <li>{@link com.phillippitts.anomalyguard.exception.ClockSkewRejectedException} - record stamped
 *       too far ahead of the buffer clock (dropped, counted)</li>
 *   <li>{@link com.phillippitts.anomalyguard.exception.InsufficientHistoryException} - not enough
 *       windows to train (retraining deferred)</li>
 *   <li>{@link com.phillippitts.anomalyguard.exception.TrainingFailureException} - training could
 *       not produce a model (previous model retained)</li>
 *   <li>{@link com.phillippitts.anomalyguard.exception.ModelCorruptException} - stored model failed
 *       its integrity check (treated as not found)</li>
 * </ul>
 *
 * <p>None of these is fatal: every error is contained in the pipeline run of the series that
 * raised it. Unknown series are created on their first record, so there is no "unknown series"
 * error.
 *
 * @since 1.0
 */
package com.phillippitts.anomalyguard.exception;
