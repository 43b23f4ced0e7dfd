package com.curvematch.core.classification;

import com.curvematch.core.config.MatcherConfig;
import com.curvematch.core.exec.IndexedWorkers;
import com.curvematch.core.model.CandidateCurve;
import com.curvematch.core.model.ClassificationOutcome;
import com.curvematch.core.model.Observation;
import com.curvematch.core.model.SelectionRecord;
import com.curvematch.core.model.SelectionSet;
import com.curvematch.core.model.SeriesId;
import com.curvematch.core.model.UnassignedReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Assigns observations to the candidate curves chosen by
 * {@link com.curvematch.core.selection.FunctionSelector}.
 *
 * <p>
 * An observation matches a chosen candidate when
 * {@code |obs.y - candidate.y[nearest grid index]| <= maxDeviation * sqrt(2)},
 * where {@code maxDeviation} is the largest per-point deviation recorded for
 * that series during selection. The boundary is inclusive.
 * </p>
 *
 * <h3>Multi-series policy</h3>
 * <p>
 * Each observation is tested against the chosen candidate of all four
 * series. Among the candidates whose threshold it satisfies, the one with the
 * smallest deviation wins; equal deviations go to the earlier series in
 * {@code Y1..Y4} order. If none qualifies the observation is unassigned.
 * </p>
 *
 * <h3>Grid lookup</h3>
 * <p>
 * The observation's x is resolved to the nearest grid point. An x outside the
 * grid's coverage (widened by the configured tolerance) is recorded as
 * {@link UnassignedReason#OUTSIDE_GRID} and does not affect other
 * observations.
 * </p>
 *
 * @since 1.0.0
 */
public class PointClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(PointClassifier.class);

    /** Fixed factor applied to a series' maximum deviation. */
    public static final double THRESHOLD_FACTOR = Math.sqrt(2.0);

    private final double gridTolerance;
    private final IndexedWorkers workers;

    /**
     * @param config matcher configuration; must not be {@code null}
     */
    public PointClassifier(MatcherConfig config) {
        Objects.requireNonNull(config, "MatcherConfig must not be null");
        config.validate();
        this.gridTolerance = config.getGridTolerance();
        this.workers = new IndexedWorkers(config.getParallelism(), "curve-classify");
    }

    /**
     * @param maxDeviation maximum absolute deviation of a series' chosen
     *                     candidate
     * @return the acceptance bound for observations
     */
    public static double thresholdFor(double maxDeviation) {
        return maxDeviation * THRESHOLD_FACTOR;
    }

    /**
     * Test an observation against one series' chosen candidate.
     *
     * @param observation the observation; must not be {@code null}
     * @param record      selection record of the series
     * @param chosen      the candidate curve named by {@code record}
     * @return assigned to {@code chosen}, or unassigned with a reason
     * @throws IllegalArgumentException if {@code chosen} is not the candidate
     *                                  named by {@code record}
     */
    public ClassificationOutcome classify(Observation observation, SelectionRecord record, CandidateCurve chosen) {
        Objects.requireNonNull(observation, "Observation must not be null");
        Objects.requireNonNull(record, "Selection record must not be null");
        Objects.requireNonNull(chosen, "Chosen candidate must not be null");
        if (chosen.getIndex() != record.getCandidateIndex()) {
            throw new IllegalArgumentException("Candidate " + chosen.getIndex()
                    + " is not the choice of series " + record.getSeriesId().label()
                    + " (candidate " + record.getCandidateIndex() + ")");
        }

        OptionalInt gridIndex = chosen.getGrid().locate(observation.getX(), gridTolerance);
        if (gridIndex.isEmpty()) {
            return ClassificationOutcome.unassigned(UnassignedReason.OUTSIDE_GRID);
        }

        double deviation = Math.abs(observation.getY() - chosen.y(gridIndex.getAsInt()));
        if (deviation <= thresholdFor(record.getMaxDeviation())) {
            return ClassificationOutcome.assigned(record.getSeriesId(), chosen.getIndex(), deviation);
        }
        return ClassificationOutcome.unassigned(UnassignedReason.NO_QUALIFYING_CANDIDATE);
    }

    /**
     * Apply the multi-series policy to one observation without recording
     * the result.
     *
     * @param observation the observation; must not be {@code null}
     * @param selections  the four selection records
     * @param candidates  the candidate library in index order
     * @return the best qualifying assignment, or unassigned with a reason
     */
    public ClassificationOutcome classify(Observation observation, SelectionSet selections,
            List<CandidateCurve> candidates) {
        Objects.requireNonNull(observation, "Observation must not be null");
        Objects.requireNonNull(selections, "Selection set must not be null");
        Objects.requireNonNull(candidates, "Candidate list must not be null");

        ClassificationOutcome best = null;
        double bestDeviation = Double.POSITIVE_INFINITY;
        boolean outsideGrid = false;

        for (SeriesId id : SeriesId.values()) {
            SelectionRecord record = selections.get(id);
            ClassificationOutcome outcome = classify(observation, record, chosenCandidate(record, candidates));
            if (outcome.isAssigned()) {
                double deviation = outcome.getDeviation().getAsDouble();
                if (best == null || deviation < bestDeviation) {
                    best = outcome;
                    bestDeviation = deviation;
                }
            } else if (outcome.getReason().orElseThrow() == UnassignedReason.OUTSIDE_GRID) {
                outsideGrid = true;
            }
        }

        if (best != null) {
            return best;
        }
        return ClassificationOutcome.unassigned(outsideGrid
                ? UnassignedReason.OUTSIDE_GRID
                : UnassignedReason.NO_QUALIFYING_CANDIDATE);
    }

    /**
     * Classify every observation and record each outcome on its observation.
     *
     * <p>
     * Outcomes are computed first (possibly on several workers) and then
     * written in list order, so an invalid selection aborts before any
     * observation is touched.
     * </p>
     *
     * @param observations observations to classify; none may be processed yet
     * @param selections   the four selection records
     * @param candidates   the candidate library in index order
     * @return counts of assigned and unassigned observations
     * @throws IllegalStateException if an observation was already classified
     *                               or the same instance occurs twice
     */
    public ClassificationSummary classifyAll(List<Observation> observations, SelectionSet selections,
            List<CandidateCurve> candidates) {
        Objects.requireNonNull(observations, "Observation list must not be null");
        Objects.requireNonNull(selections, "Selection set must not be null");
        Objects.requireNonNull(candidates, "Candidate list must not be null");
        for (SelectionRecord record : selections.records()) {
            chosenCandidate(record, candidates);
        }
        Set<Observation> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Observation observation : observations) {
            Objects.requireNonNull(observation, "Observation list must not contain null");
            if (observation.isProcessed()) {
                throw new IllegalStateException("Observation already classified: " + observation);
            }
            if (!seen.add(observation)) {
                throw new IllegalStateException("Observation appears more than once in the batch: " + observation);
            }
        }

        ClassificationOutcome[] outcomes = new ClassificationOutcome[observations.size()];
        workers.forEachIndex(outcomes.length,
                i -> outcomes[i] = classify(observations.get(i), selections, candidates));

        ClassificationSummary.Builder summary = ClassificationSummary.builder();
        for (int i = 0; i < outcomes.length; i++) {
            Observation observation = observations.get(i);
            ClassificationOutcome outcome = outcomes[i];
            observation.recordOutcome(outcome);
            summary.add(outcome);
            LOG.debug("Observation ({}, {}) -> {}", observation.getX(), observation.getY(), outcome);
        }

        ClassificationSummary result = summary.build();
        LOG.info("Classified {} observation(s): {} assigned, {} without qualifying candidate, {} outside grid",
                result.getTotal(), result.getAssigned(), result.getNoQualifyingCandidate(), result.getOutsideGrid());
        if (result.getOutsideGrid() > 0) {
            LOG.warn("{} observation(s) lie outside the grid [{} .. {}] (tolerance {})",
                    result.getOutsideGrid(), candidates.get(0).getGrid().first(),
                    candidates.get(0).getGrid().last(), gridTolerance);
        }
        return result;
    }

    private static CandidateCurve chosenCandidate(SelectionRecord record, List<CandidateCurve> candidates) {
        int index = record.getCandidateIndex();
        if (index < 0 || index >= candidates.size()) {
            throw new IllegalArgumentException("Series " + record.getSeriesId().label()
                    + " chose candidate " + index + " but the library has " + candidates.size() + " curve(s)");
        }
        return candidates.get(index);
    }
}
