/**
 * Domain model for curve matching.
 *
 * <ul>
 * <li>{@link com.curvematch.core.model.Grid}: shared x coordinates</li>
 * <li>{@link com.curvematch.core.model.MeasuredSeries} and
 * {@link com.curvematch.core.model.CandidateCurve}: y values on that
 * grid</li>
 * <li>{@link com.curvematch.core.model.SelectionRecord} /
 * {@link com.curvematch.core.model.SelectionSet}: selection output, one per
 * series</li>
 * <li>{@link com.curvematch.core.model.Observation}: point to classify, with
 * a write-once {@link com.curvematch.core.model.ClassificationOutcome}</li>
 * <li>{@link com.curvematch.core.model.SeriesStore}: validated input of one
 * run</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.curvematch.core.model;
