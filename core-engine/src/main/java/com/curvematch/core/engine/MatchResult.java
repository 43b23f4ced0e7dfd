package com.curvematch.core.engine;

import com.curvematch.core.classification.ClassificationSummary;
import com.curvematch.core.model.CandidateCurve;
import com.curvematch.core.model.Observation;
import com.curvematch.core.model.SelectionSet;
import com.curvematch.core.model.SeriesStore;

import java.util.List;
import java.util.Objects;

/**
 * Output of one {@link CurveMatchEngine} run.
 *
 * @since 1.0.0
 */
public final class MatchResult {

    private final SeriesStore store;
    private final SelectionSet selections;
    private final ClassificationSummary summary;

    MatchResult(SeriesStore store, SelectionSet selections, ClassificationSummary summary) {
        this.store = Objects.requireNonNull(store, "SeriesStore must not be null");
        this.selections = Objects.requireNonNull(selections, "Selection set must not be null");
        this.summary = Objects.requireNonNull(summary, "Summary must not be null");
    }

    public SelectionSet getSelections() {
        return selections;
    }

    public ClassificationSummary getSummary() {
        return summary;
    }

    /**
     * @return the classified observations, each carrying its outcome
     */
    public List<Observation> getObservations() {
        return store.getObservations();
    }

    public List<CandidateCurve> getCandidates() {
        return store.getCandidates();
    }

    public SeriesStore getStore() {
        return store;
    }

    @Override
    public String toString() {
        return "MatchResult{selections=" + selections + ", summary=" + summary + '}';
    }
}
