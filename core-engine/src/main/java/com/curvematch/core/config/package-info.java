/**
 * Configuration for the matching engine.
 *
 * <p>
 * {@link com.curvematch.core.config.MatcherConfigLoader} reads YAML into a
 * {@link com.curvematch.core.config.MatcherConfig}, which is then passed to
 * the selector and classifier constructors. Validation runs right after
 * parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.curvematch.core.config;
