/**
 * Stage-level failures of the matching engine.
 *
 * <p>
 * {@link com.curvematch.core.error.ShapeException} and
 * {@link com.curvematch.core.error.EmptyInputException} abort selection before
 * any scoring takes place. Both are unchecked.
 * </p>
 *
 * @since 1.0.0
 */
package com.curvematch.core.error;
