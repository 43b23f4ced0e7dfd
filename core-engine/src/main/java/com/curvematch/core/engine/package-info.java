/**
 * Entry point into the matching engine for callers that hold a complete
 * {@link com.curvematch.core.model.SeriesStore}.
 *
 * @since 1.0.0
 */
package com.curvematch.core.engine;
