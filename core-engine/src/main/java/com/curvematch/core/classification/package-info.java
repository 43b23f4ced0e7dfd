/**
 * Deviation-threshold classification of observations.
 *
 * <p>
 * {@link com.curvematch.core.classification.PointClassifier} tests each
 * observation against the chosen candidate of every measured series and
 * records a terminal {@link com.curvematch.core.model.ClassificationOutcome}.
 * </p>
 *
 * @since 1.0.0
 */
package com.curvematch.core.classification;
