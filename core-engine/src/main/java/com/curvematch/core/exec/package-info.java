/**
 * Bounded worker pool for index-parallel scoring and classification.
 *
 * @since 1.0.0
 */
package com.curvematch.core.exec;
