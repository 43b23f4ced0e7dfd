package com.curvematch.batch;

import com.curvematch.core.config.MatcherConfig;
import com.curvematch.core.config.MatcherConfigLoader;
import com.curvematch.core.engine.CurveMatchEngine;
import com.curvematch.core.engine.MatchResult;
import com.curvematch.core.model.SelectionRecord;
import com.curvematch.core.model.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for a batch curve matching run.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   train.csv + ideal.csv + test.csv
 *     → CsvDataLoader → SeriesStore
 *     → FunctionSelector (one ideal function per training series)
 *     → PointClassifier (sqrt(2) threshold per test observation)
 *     → ResultsWriter → results.json
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * File locations come from {@link JobConfig#fromEnvironment()}; matcher
 * settings from {@link MatcherConfigLoader#resolve(String)}, with the job's
 * explicit path taking precedence.
 * </p>
 *
 * @since 1.0.0
 */
public final class CurveMatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(CurveMatchJob.class);

    private CurveMatchJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        try {
            run(JobConfig.fromEnvironment());
        } catch (RuntimeException e) {
            LOG.error("Curve matching failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Load, match, classify and export.
     *
     * @param config job configuration
     * @return the completed result, already written to
     *         {@link JobConfig#getResultsPath()}
     * @throws DataLoadException if an input table cannot be read
     */
    public static MatchResult run(JobConfig config) {
        Objects.requireNonNull(config, "JobConfig must not be null");
        LOG.info("Starting curve matching with config: {}", config);

        MatcherConfig matcherConfig = MatcherConfigLoader.resolve(config.getMatcherConfigPath());

        SeriesStore store = new CsvDataLoader().load(
                config.getTrainingPath(), config.getIdealPath(), config.getTestPath());

        MatchResult result = new CurveMatchEngine(matcherConfig).run(store);
        for (SelectionRecord record : result.getSelections().records()) {
            LOG.info("Training series {} best fits ideal function y{} (max deviation {})",
                    record.getSeriesId().label(), record.getCandidateIndex() + 1, record.getMaxDeviation());
        }

        new ResultsWriter().write(result, config.getResultsPath());
        return result;
    }
}
