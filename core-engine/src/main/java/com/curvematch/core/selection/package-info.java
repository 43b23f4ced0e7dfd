/**
 * Least-squares selection of candidate curves.
 *
 * @since 1.0.0
 */
package com.curvematch.core.selection;
