package com.curvematch.batch;

import com.curvematch.core.classification.ClassificationSummary;
import com.curvematch.core.classification.PointClassifier;
import com.curvematch.core.engine.MatchResult;
import com.curvematch.core.model.ClassificationOutcome;
import com.curvematch.core.model.Observation;
import com.curvematch.core.model.SelectionRecord;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * JSON shape of an exported {@link MatchResult}.
 *
 * <p>
 * Function numbers are 1-based ({@code candidateIndex + 1}); unassigned
 * observations carry {@code null} for {@code deltaY}, {@code idealFunction}
 * and {@code series}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonPropertyOrder({"generatedAt", "summary", "selections", "observations"})
public final class ResultsDocument {

    private final Instant generatedAt;
    private final Summary summary;
    private final List<SelectionEntry> selections;
    private final List<ObservationEntry> observations;

    private ResultsDocument(Instant generatedAt, Summary summary,
            List<SelectionEntry> selections, List<ObservationEntry> observations) {
        this.generatedAt = generatedAt;
        this.summary = summary;
        this.selections = Collections.unmodifiableList(selections);
        this.observations = Collections.unmodifiableList(observations);
    }

    /**
     * @param result      a completed match run
     * @param generatedAt export timestamp
     * @return the document to serialize
     * @throws IllegalStateException if an observation has no outcome yet
     */
    public static ResultsDocument from(MatchResult result, Instant generatedAt) {
        Objects.requireNonNull(result, "MatchResult must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");

        List<SelectionEntry> selections = new ArrayList<>();
        for (SelectionRecord record : result.getSelections().records()) {
            selections.add(new SelectionEntry(record));
        }
        List<ObservationEntry> observations = new ArrayList<>();
        for (Observation observation : result.getObservations()) {
            ClassificationOutcome outcome = observation.getOutcome().orElseThrow(() ->
                    new IllegalStateException("Observation was never classified: " + observation));
            observations.add(new ObservationEntry(observation, outcome));
        }
        return new ResultsDocument(generatedAt, new Summary(result.getSummary()), selections, observations);
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Summary getSummary() {
        return summary;
    }

    public List<SelectionEntry> getSelections() {
        return selections;
    }

    public List<ObservationEntry> getObservations() {
        return observations;
    }

    // ---------------------------------------------------------------
    // Entries
    // ---------------------------------------------------------------

    @JsonPropertyOrder({"observations", "assigned", "noQualifyingCandidate", "outsideGrid"})
    public static final class Summary {
        private final ClassificationSummary summary;

        Summary(ClassificationSummary summary) {
            this.summary = summary;
        }

        public int getObservations() {
            return summary.getTotal();
        }

        public int getAssigned() {
            return summary.getAssigned();
        }

        public int getNoQualifyingCandidate() {
            return summary.getNoQualifyingCandidate();
        }

        public int getOutsideGrid() {
            return summary.getOutsideGrid();
        }
    }

    @JsonPropertyOrder({"series", "candidateIndex", "idealFunction", "sumSquaredDeviations",
            "maxDeviation", "threshold"})
    public static final class SelectionEntry {
        private final SelectionRecord record;

        SelectionEntry(SelectionRecord record) {
            this.record = record;
        }

        public String getSeries() {
            return record.getSeriesId().label();
        }

        public int getCandidateIndex() {
            return record.getCandidateIndex();
        }

        public int getIdealFunction() {
            return record.getCandidateIndex() + 1;
        }

        public double getSumSquaredDeviations() {
            return record.getSumSquaredDeviations();
        }

        public double getMaxDeviation() {
            return record.getMaxDeviation();
        }

        public double getThreshold() {
            return PointClassifier.thresholdFor(record.getMaxDeviation());
        }
    }

    @JsonPropertyOrder({"x", "y", "deltaY", "idealFunction", "series", "status", "reason"})
    public static final class ObservationEntry {
        private final Observation observation;
        private final ClassificationOutcome outcome;

        ObservationEntry(Observation observation, ClassificationOutcome outcome) {
            this.observation = observation;
            this.outcome = outcome;
        }

        public double getX() {
            return observation.getX();
        }

        public double getY() {
            return observation.getY();
        }

        public Double getDeltaY() {
            return outcome.isAssigned() ? outcome.getDeviation().getAsDouble() : null;
        }

        public Integer getIdealFunction() {
            return outcome.isAssigned() ? outcome.getCandidateIndex().getAsInt() + 1 : null;
        }

        public String getSeries() {
            return outcome.getSeriesId().map(id -> id.label()).orElse(null);
        }

        public String getStatus() {
            return outcome.isAssigned() ? "ASSIGNED" : "UNASSIGNED";
        }

        public String getReason() {
            return outcome.getReason().map(Enum::name).orElse(null);
        }
    }
}
