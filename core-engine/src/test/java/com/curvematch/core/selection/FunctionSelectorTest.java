package com.curvematch.core.selection;

import com.curvematch.core.config.MatcherConfig;
import com.curvematch.core.error.EmptyInputException;
import com.curvematch.core.error.ShapeException;
import com.curvematch.core.model.CandidateCurve;
import com.curvematch.core.model.Grid;
import com.curvematch.core.model.MeasuredSeries;
import com.curvematch.core.model.SelectionRecord;
import com.curvematch.core.model.SelectionSet;
import com.curvematch.core.model.SeriesId;
import com.curvematch.core.model.SeriesStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FunctionSelector}.
 */
class FunctionSelectorTest {

    private final FunctionSelector selector = new FunctionSelector(MatcherConfig.defaults());

    @Test
    @DisplayName("Should choose the exactly matching candidate with zero SSD")
    void shouldChooseExactMatch() {
        Grid grid = Grid.of(0.0, 1.0);
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, grid, 1.0, 2.0);
        List<CandidateCurve> candidates = List.of(
                new CandidateCurve(0, grid, 1.0, 2.0),
                new CandidateCurve(1, grid, 5.0, 6.0));

        SelectionRecord record = selector.selectBest(measured, candidates);

        assertThat(record.getSeriesId()).isEqualTo(SeriesId.Y1);
        assertThat(record.getCandidateIndex()).isZero();
        assertThat(record.getSumSquaredDeviations()).isEqualTo(0.0);
        assertThat(record.getMaxDeviation()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should record per-point absolute deviations of the winner")
    void shouldRecordDeviationsOfWinner() {
        Grid grid = Grid.of(0.0, 1.0, 2.0);
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y2, grid, 1.0, 2.0, 3.0);
        List<CandidateCurve> candidates = List.of(
                new CandidateCurve(0, grid, 10.0, 10.0, 10.0),
                new CandidateCurve(1, grid, 1.5, 2.0, 1.0));

        SelectionRecord record = selector.selectBest(measured, candidates);

        assertThat(record.getCandidateIndex()).isEqualTo(1);
        assertThat(record.getSumSquaredDeviations()).isCloseTo(4.25, within(1e-12));
        assertThat(record.getDeviations()).containsExactly(0.5, 0.0, 2.0);
        assertThat(record.getMaxDeviation()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should pick the lowest index when candidates tie on SSD")
    void shouldBreakTiesByLowestIndex() {
        Grid grid = Grid.of(0.0, 1.0, 2.0);
        double[] ys = {3.0, 1.0, 4.0};
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, grid, ys);

        List<CandidateCurve> candidates = new ArrayList<>();
        for (int c = 0; c < 10; c++) {
            double offset = (c == 3 || c == 7) ? 0.0 : c + 1.0;
            candidates.add(new CandidateCurve(c, grid, ys[0] + offset, ys[1] + offset, ys[2] + offset));
        }

        assertThat(selector.selectBest(measured, candidates).getCandidateIndex()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should still rank candidates correctly when every SSD overflows")
    void shouldRankWhenScoresOverflow() {
        Grid grid = Grid.of(0.0, 1.0);
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, grid, 1e200, 1e200);
        List<CandidateCurve> candidates = List.of(
                new CandidateCurve(0, grid, -1e200, -1e200),
                new CandidateCurve(1, grid, 0.0, 0.0),
                new CandidateCurve(2, grid, -Double.MAX_VALUE, -Double.MAX_VALUE));

        SelectionRecord record = selector.selectBest(measured, candidates);

        assertThat(record.getCandidateIndex()).isEqualTo(1);
        assertThat(record.getSumSquaredDeviations()).isInfinite();
        assertThat(record.getMaxDeviation()).isEqualTo(1e200);
    }

    @Test
    @DisplayName("Should keep the lowest index on ties among overflowing scores")
    void shouldBreakOverflowTiesByLowestIndex() {
        Grid grid = Grid.of(0.0);
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, grid, 0.0);
        List<CandidateCurve> candidates = List.of(
                new CandidateCurve(0, grid, 3e200),
                new CandidateCurve(1, grid, -1e200),
                new CandidateCurve(2, grid, 1e200));

        assertThat(selector.selectBest(measured, candidates).getCandidateIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail before scoring when candidates are one point short")
    void shouldFailOnLengthMismatch() {
        Grid measuredGrid = Grid.of(sequence(400));
        Grid shortGrid = Grid.of(sequence(399));
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, measuredGrid, new double[400]);
        List<CandidateCurve> candidates = List.of(
                new CandidateCurve(0, shortGrid, new double[399]),
                new CandidateCurve(1, shortGrid, new double[399]));

        assertThatThrownBy(() -> selector.selectBest(measured, candidates))
                .isInstanceOf(ShapeException.class)
                .hasMessageContaining("399")
                .hasMessageContaining("400");
    }

    @Test
    @DisplayName("Should reject a library where only the last curve is misaligned")
    void shouldValidateWholeLibraryFirst() {
        Grid grid = Grid.of(0.0, 1.0);
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, grid, 1.0, 2.0);
        List<CandidateCurve> candidates = List.of(
                new CandidateCurve(0, grid, 1.0, 2.0),
                new CandidateCurve(1, Grid.of(0.0, 2.0), 1.0, 2.0));

        assertThatThrownBy(() -> selector.selectBest(measured, candidates))
                .isInstanceOf(ShapeException.class)
                .hasMessageContaining("Candidate curve 1");
    }

    @Test
    @DisplayName("Should fail on an empty candidate library")
    void shouldFailOnEmptyLibrary() {
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, Grid.of(0.0), 1.0);

        assertThatThrownBy(() -> selector.selectBest(measured, List.of()))
                .isInstanceOf(EmptyInputException.class);
    }

    @Test
    @DisplayName("Should enforce the configured library size")
    void shouldEnforceExpectedCandidateCount() {
        MatcherConfig config = new MatcherConfig();
        config.setExpectedCandidateCount(50);
        FunctionSelector strict = new FunctionSelector(config);
        Grid grid = Grid.of(0.0);
        MeasuredSeries measured = new MeasuredSeries(SeriesId.Y1, grid, 1.0);

        assertThatThrownBy(() -> strict.selectBest(measured, List.of(new CandidateCurve(0, grid, 1.0))))
                .isInstanceOf(ShapeException.class)
                .hasMessageContaining("Expected 50");
    }

    @Test
    @DisplayName("Should key selections by series identity")
    void shouldSelectPerSeries() {
        Grid grid = Grid.of(0.0, 1.0);
        SeriesStore store = SeriesStore.builder(grid)
                .measured(SeriesId.Y1, 20.0, 20.0)
                .measured(SeriesId.Y2, 0.0, 0.0)
                .measured(SeriesId.Y3, 10.0, 11.0)
                .measured(SeriesId.Y4, 19.0, 21.0)
                .candidate(0.0, 0.0)
                .candidate(10.0, 10.0)
                .candidate(20.0, 20.0)
                .build();

        SelectionSet selections = selector.selectAll(store);

        assertThat(selections.get(SeriesId.Y1).getCandidateIndex()).isEqualTo(2);
        assertThat(selections.get(SeriesId.Y2).getCandidateIndex()).isEqualTo(0);
        assertThat(selections.get(SeriesId.Y3).getCandidateIndex()).isEqualTo(1);
        assertThat(selections.get(SeriesId.Y4).getCandidateIndex()).isEqualTo(2);
        assertThat(selections.get(SeriesId.Y4).getMaxDeviation()).isEqualTo(1.0);
        assertThat(selections.records()).extracting(SelectionRecord::getSeriesId)
                .containsExactly(SeriesId.Y1, SeriesId.Y2, SeriesId.Y3, SeriesId.Y4);
    }

    @Test
    @DisplayName("Should fail when one of the four series is missing")
    void shouldFailOnMissingSeries() {
        Grid grid = Grid.of(0.0);
        Map<SeriesId, MeasuredSeries> measured = new EnumMap<>(SeriesId.class);
        measured.put(SeriesId.Y1, new MeasuredSeries(SeriesId.Y1, grid, 1.0));

        assertThatThrownBy(() -> selector.selectAll(measured, List.of(new CandidateCurve(0, grid, 1.0))))
                .isInstanceOf(ShapeException.class)
                .hasMessageContaining("y2");
    }

    @Test
    @DisplayName("Should fail when measured series have different lengths")
    void shouldFailOnSeriesLengthMismatch() {
        Grid grid = Grid.of(0.0, 1.0);
        Map<SeriesId, MeasuredSeries> measured = new EnumMap<>(SeriesId.class);
        measured.put(SeriesId.Y1, new MeasuredSeries(SeriesId.Y1, grid, 1.0, 2.0));
        measured.put(SeriesId.Y2, new MeasuredSeries(SeriesId.Y2, grid, 1.0, 2.0));
        measured.put(SeriesId.Y3, new MeasuredSeries(SeriesId.Y3, Grid.of(0.0), 1.0));
        measured.put(SeriesId.Y4, new MeasuredSeries(SeriesId.Y4, grid, 1.0, 2.0));

        assertThatThrownBy(() -> selector.selectAll(measured, List.of(new CandidateCurve(0, grid, 1.0, 2.0))))
                .isInstanceOf(ShapeException.class)
                .hasMessageContaining("y3");
    }

    @Test
    @DisplayName("Should never choose a candidate with a larger SSD than another")
    void shouldBeOptimal() {
        SeriesStore store = randomStore(new Random(42), 60, 50);

        SelectionSet selections = selector.selectAll(store);

        for (SeriesId id : SeriesId.values()) {
            MeasuredSeries measured = store.getMeasured(id);
            SelectionRecord record = selections.get(id);
            double chosen = bruteForceSsd(measured, store.getCandidates().get(record.getCandidateIndex()));
            assertThat(record.getSumSquaredDeviations()).isEqualTo(chosen);
            for (CandidateCurve candidate : store.getCandidates()) {
                assertThat(chosen).isLessThanOrEqualTo(bruteForceSsd(measured, candidate));
            }
        }
    }

    @Test
    @DisplayName("Should produce identical selections on repeated runs")
    void shouldBeDeterministic() {
        SeriesStore store = randomStore(new Random(7), 40, 50);

        assertThat(selector.selectAll(store)).isEqualTo(selector.selectAll(store));
    }

    @Test
    @DisplayName("Should produce the same selections with parallel scoring, ties included")
    void shouldMatchSequentialWhenParallel() {
        Random random = new Random(11);
        Grid grid = Grid.of(sequence(30));
        SeriesStore.Builder builder = SeriesStore.builder(grid);
        double[] shared = randomValues(random, 30);
        for (SeriesId id : SeriesId.values()) {
            builder.measured(id, shared);
        }
        for (int c = 0; c < 50; c++) {
            builder.candidate(c % 5 == 2 ? shared : randomValues(random, 30));
        }
        SeriesStore store = builder.build();

        MatcherConfig parallelConfig = new MatcherConfig();
        parallelConfig.setParallelism(4);
        SelectionSet parallel = new FunctionSelector(parallelConfig).selectAll(store);

        assertThat(parallel).isEqualTo(selector.selectAll(store));
        assertThat(parallel.get(SeriesId.Y1).getCandidateIndex()).isEqualTo(2);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] sequence(int n) {
        double[] xs = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = -20.0 + 0.1 * i;
        }
        return xs;
    }

    private static double[] randomValues(Random random, int n) {
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            ys[i] = random.nextGaussian() * 10.0;
        }
        return ys;
    }

    private static SeriesStore randomStore(Random random, int points, int candidates) {
        SeriesStore.Builder builder = SeriesStore.builder(Grid.of(sequence(points)));
        for (SeriesId id : SeriesId.values()) {
            builder.measured(id, randomValues(random, points));
        }
        for (int c = 0; c < candidates; c++) {
            builder.candidate(randomValues(random, points));
        }
        return builder.build();
    }

    private static double bruteForceSsd(MeasuredSeries measured, CandidateCurve candidate) {
        double[] m = measured.getYs();
        double[] c = candidate.getYs();
        double sum = 0.0;
        for (int i = 0; i < m.length; i++) {
            sum += (m[i] - c[i]) * (m[i] - c[i]);
        }
        return sum;
    }
}
