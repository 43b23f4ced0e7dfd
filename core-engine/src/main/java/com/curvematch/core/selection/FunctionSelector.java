package com.curvematch.core.selection;

import com.curvematch.core.config.MatcherConfig;
import com.curvematch.core.error.EmptyInputException;
import com.curvematch.core.error.ShapeException;
import com.curvematch.core.exec.IndexedWorkers;
import com.curvematch.core.model.CandidateCurve;
import com.curvematch.core.model.MeasuredSeries;
import com.curvematch.core.model.SelectionRecord;
import com.curvematch.core.model.SelectionSet;
import com.curvematch.core.model.SeriesId;
import com.curvematch.core.model.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Least-squares selection of the candidate curve that best matches a
 * measured series.
 *
 * <p>
 * Every candidate {@code c} is scored by
 * {@code SSD(c) = sum over i of (measured.y[i] - c.y[i])^2}; the candidate
 * with the smallest score wins. On an exact tie the lower index wins. Scores
 * may be computed on several workers, but the minimum is always taken by an
 * ascending scan over the full score array. If even the best score
 * overflows to infinity, candidates are ranked again by deviations divided by
 * the largest one; the recorded SSD stays infinite.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * All shape checks run before the first score is computed. A length or grid
 * mismatch raises {@link ShapeException}; an empty library raises
 * {@link EmptyInputException}. Nothing is truncated.
 * </p>
 *
 * @since 1.0.0
 */
public class FunctionSelector {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionSelector.class);

    private final MatcherConfig config;
    private final IndexedWorkers workers;

    /**
     * @param config matcher configuration; must not be {@code null}
     */
    public FunctionSelector(MatcherConfig config) {
        this.config = Objects.requireNonNull(config, "MatcherConfig must not be null");
        config.validate();
        this.workers = new IndexedWorkers(config.getParallelism(), "curve-scoring");
    }

    /**
     * Select the best candidate for a single measured series.
     *
     * @param measured   the measured series; must not be {@code null}
     * @param candidates the candidate library in index order; must not be
     *                   {@code null}
     * @return the selection record for {@code measured}
     * @throws EmptyInputException if {@code candidates} is empty
     * @throws ShapeException      if any candidate is not aligned with the
     *                             measured series
     */
    public SelectionRecord selectBest(MeasuredSeries measured, List<CandidateCurve> candidates) {
        Objects.requireNonNull(measured, "Measured series must not be null");
        validateLibrary(candidates);
        validateAlignment(measured, candidates);
        return score(measured, candidates);
    }

    /**
     * Select the best candidate for each of the four measured series.
     *
     * <p>
     * Shapes of all four series are validated before any of them is scored.
     * </p>
     *
     * @param measured   the four measured series keyed by identity; must not
     *                   be {@code null}
     * @param candidates the candidate library in index order
     * @return one record per series
     * @throws ShapeException      if a series is missing or misaligned
     * @throws EmptyInputException if {@code candidates} is empty
     */
    public SelectionSet selectAll(Map<SeriesId, MeasuredSeries> measured, List<CandidateCurve> candidates) {
        Objects.requireNonNull(measured, "Measured series map must not be null");
        validateLibrary(candidates);

        for (SeriesId id : SeriesId.values()) {
            MeasuredSeries series = measured.get(id);
            if (series == null) {
                throw new ShapeException("Measured series " + id.label() + " is missing");
            }
            if (series.getId() != id) {
                throw new IllegalArgumentException("Measured series " + series.getId().label()
                        + " filed under " + id.label());
            }
        }
        MeasuredSeries reference = measured.get(SeriesId.Y1);
        for (SeriesId id : SeriesId.values()) {
            MeasuredSeries series = measured.get(id);
            if (!reference.getGrid().isCompatibleWith(series.getGrid())) {
                throw new ShapeException("Measured series " + id.label() + " has " + series.size()
                        + " point(s) on a different grid than y1 (" + reference.size() + " point(s))");
            }
            validateAlignment(series, candidates);
        }

        LOG.info("Scoring {} candidate curve(s) against {} measured series ({} grid point(s), parallelism={})",
                candidates.size(), SeriesId.values().length,
                reference.size(), workers.getParallelism());

        Map<SeriesId, SelectionRecord> records = new EnumMap<>(SeriesId.class);
        for (SeriesId id : SeriesId.values()) {
            SelectionRecord record = score(measured.get(id), candidates);
            LOG.info("Series {} -> candidate {} (SSD={}, max deviation={})",
                    id.label(), record.getCandidateIndex(),
                    record.getSumSquaredDeviations(), record.getMaxDeviation());
            records.put(id, record);
        }
        return new SelectionSet(records);
    }

    /**
     * Convenience overload for a complete {@link SeriesStore}.
     *
     * @param store the input store; must not be {@code null}
     * @return one record per series
     */
    public SelectionSet selectAll(SeriesStore store) {
        Objects.requireNonNull(store, "SeriesStore must not be null");
        return selectAll(store.getMeasuredSeries(), store.getCandidates());
    }

    /**
     * Sum of squared deviations between a measured series and a candidate of
     * the same length.
     *
     * @param measured  the measured series
     * @param candidate the candidate curve
     * @return the SSD, accumulated in grid order; positive infinity when the
     *         sum exceeds the double range
     * @throws ShapeException if the lengths differ
     */
    public static double sumSquaredDeviations(MeasuredSeries measured, CandidateCurve candidate) {
        if (measured.size() != candidate.size()) {
            throw new ShapeException("Candidate curve " + candidate.getIndex() + " has " + candidate.size()
                    + " point(s) but measured series " + measured.getId().label()
                    + " has " + measured.size());
        }
        double sum = 0.0;
        for (int i = 0; i < measured.size(); i++) {
            double diff = measured.y(i) - candidate.y(i);
            sum += diff * diff;
        }
        return sum;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SelectionRecord score(MeasuredSeries measured, List<CandidateCurve> candidates) {
        double[] scores = new double[candidates.size()];
        workers.forEachIndex(scores.length,
                c -> scores[c] = sumSquaredDeviations(measured, candidates.get(c)));

        int best = lowestScore(scores);
        if (!Double.isFinite(scores[best])) {
            double scale = largestDeviation(measured, candidates);
            LOG.warn("Series {}: SSD overflows double range, ranking by scores scaled by {}",
                    measured.getId().label(), scale);
            double[] scaled = new double[candidates.size()];
            workers.forEachIndex(scaled.length,
                    c -> scaled[c] = scaledSumSquaredDeviations(measured, candidates.get(c), scale));
            best = lowestScore(scaled);
        }

        CandidateCurve chosen = candidates.get(best);
        double[] deviations = new double[measured.size()];
        for (int i = 0; i < deviations.length; i++) {
            deviations[i] = Math.abs(measured.y(i) - chosen.y(i));
        }

        LOG.debug("Series {}: best candidate {} of {} with SSD={}",
                measured.getId().label(), best, scores.length, scores[best]);
        return new SelectionRecord(measured.getId(), best, scores[best], deviations);
    }

    private static int lowestScore(double[] scores) {
        int best = 0;
        for (int c = 1; c < scores.length; c++) {
            if (scores[c] < scores[best]) {
                best = c;
            }
        }
        return best;
    }

    private static double largestDeviation(MeasuredSeries measured, List<CandidateCurve> candidates) {
        double max = 0.0;
        for (CandidateCurve candidate : candidates) {
            for (int i = 0; i < measured.size(); i++) {
                max = Math.max(max, Math.min(Math.abs(measured.y(i) - candidate.y(i)), Double.MAX_VALUE));
            }
        }
        return max;
    }

    // Differences are divided before squaring, so each term is at most 1.
    // A difference that itself overflows is capped at the largest double.
    private static double scaledSumSquaredDeviations(MeasuredSeries measured, CandidateCurve candidate,
            double scale) {
        double sum = 0.0;
        for (int i = 0; i < measured.size(); i++) {
            double diff = Math.min(Math.abs(measured.y(i) - candidate.y(i)), Double.MAX_VALUE) / scale;
            sum += diff * diff;
        }
        return sum;
    }

    private void validateLibrary(List<CandidateCurve> candidates) {
        Objects.requireNonNull(candidates, "Candidate list must not be null");
        if (candidates.isEmpty()) {
            throw new EmptyInputException("Candidate library must contain at least one curve");
        }
        int expected = config.getExpectedCandidateCount();
        if (expected > 0 && candidates.size() != expected) {
            throw new ShapeException("Expected " + expected + " candidate curve(s), got " + candidates.size());
        }
        for (int c = 0; c < candidates.size(); c++) {
            CandidateCurve curve = Objects.requireNonNull(candidates.get(c),
                    "Candidate curve at position " + c + " is null");
            if (curve.getIndex() != c) {
                throw new IllegalArgumentException("Candidate curve index " + curve.getIndex()
                        + " does not match its library position " + c);
            }
        }
    }

    private static void validateAlignment(MeasuredSeries measured, List<CandidateCurve> candidates) {
        for (CandidateCurve curve : candidates) {
            if (curve.size() != measured.size()) {
                throw new ShapeException("Candidate curve " + curve.getIndex() + " has " + curve.size()
                        + " point(s) but measured series " + measured.getId().label()
                        + " has " + measured.size());
            }
            if (!curve.getGrid().isCompatibleWith(measured.getGrid())) {
                throw new ShapeException("Candidate curve " + curve.getIndex()
                        + " is not sampled on the grid of measured series " + measured.getId().label());
            }
        }
    }
}
