/**
 * Batch job that runs the curve matching engine over CSV input files.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.curvematch.batch.CurveMatchJob}: main entry point</li>
 * <li>{@link com.curvematch.batch.CsvDataLoader}: reads the training, ideal
 * and test tables</li>
 * <li>{@link com.curvematch.batch.ResultsWriter}: JSON export of selections
 * and classified observations</li>
 * <li>{@link com.curvematch.batch.JobConfig}: environment-driven
 * configuration</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.curvematch.batch;
