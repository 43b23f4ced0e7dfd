package com.curvematch.core.engine;

import com.curvematch.core.classification.ClassificationSummary;
import com.curvematch.core.classification.PointClassifier;
import com.curvematch.core.config.MatcherConfig;
import com.curvematch.core.model.SelectionSet;
import com.curvematch.core.model.SeriesStore;
import com.curvematch.core.selection.FunctionSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs selection followed by classification over one {@link SeriesStore}.
 *
 * <p>
 * Selection failures ({@link com.curvematch.core.error.ShapeException},
 * {@link com.curvematch.core.error.EmptyInputException}) propagate before
 * any observation is classified.
 * </p>
 *
 * @since 1.0.0
 */
public class CurveMatchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(CurveMatchEngine.class);

    private final FunctionSelector selector;
    private final PointClassifier classifier;

    public CurveMatchEngine(MatcherConfig config) {
        this(new FunctionSelector(config), new PointClassifier(config));
    }

    public CurveMatchEngine(FunctionSelector selector, PointClassifier classifier) {
        this.selector = Objects.requireNonNull(selector, "FunctionSelector must not be null");
        this.classifier = Objects.requireNonNull(classifier, "PointClassifier must not be null");
    }

    /**
     * @param store validated input; its observations must be unprocessed
     * @return selections and classification counts; outcomes are recorded on
     *         the store's observations
     */
    public MatchResult run(SeriesStore store) {
        Objects.requireNonNull(store, "SeriesStore must not be null");
        LOG.info("Starting match run on {}", store);

        SelectionSet selections = selector.selectAll(store);
        ClassificationSummary summary = classifier.classifyAll(
                store.getObservations(), selections, store.getCandidates());

        return new MatchResult(store, selections, summary);
    }
}
