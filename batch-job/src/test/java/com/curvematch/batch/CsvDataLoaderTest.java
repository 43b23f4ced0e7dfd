package com.curvematch.batch;

import com.curvematch.core.model.SeriesId;
import com.curvematch.core.model.SeriesStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CsvDataLoader}.
 */
class CsvDataLoaderTest {

    @TempDir
    Path dir;

    private final CsvDataLoader loader = new CsvDataLoader();

    @Test
    @DisplayName("Should assemble a store from the three tables")
    void shouldLoadAllTables() throws IOException {
        CsvFixtures.writeAll(dir);

        SeriesStore store = load();

        assertThat(store.getGrid().toArray()).containsExactly(0.0, 1.0, 2.0);
        assertThat(store.getMeasured(SeriesId.Y3).getYs()).containsExactly(10.0, 10.0, 10.0);
        assertThat(store.getCandidates()).hasSize(3);
        assertThat(store.getCandidates().get(2).getFunctionNumber()).isEqualTo(3);
        assertThat(store.getCandidates().get(0).getYs()).containsExactly(1.0, 2.0, 3.5);
        assertThat(store.getObservations()).hasSize(4);
        assertThat(store.getObservations().get(2).getX()).isEqualTo(7.0);
        assertThat(store.getObservations()).noneMatch(o -> o.isProcessed());
    }

    @Test
    @DisplayName("Should tolerate spaces, column order and blank trailing lines")
    void shouldTolerateFormatting() throws IOException {
        CsvFixtures.write(dir, "train.csv", "y4,y3,y2,y1,x\n3, 2, 1, 0, 0.5\n 4 ,3,2,1,1.5\n\n");
        CsvFixtures.write(dir, "ideal.csv", "x,y1,y2,extra\n0.5,0,0,x\n1.5,1,1,x\n");
        CsvFixtures.write(dir, "test.csv", "x,y\n0.5,0.0\n");

        SeriesStore store = load();

        assertThat(store.getMeasured(SeriesId.Y4).getYs()).containsExactly(3.0, 4.0);
        assertThat(store.getCandidates()).hasSize(2);
    }

    @Test
    @DisplayName("Should fail when an input file does not exist")
    void shouldFailOnMissingFile() throws IOException {
        CsvFixtures.write(dir, "train.csv", CsvFixtures.TRAINING);
        CsvFixtures.write(dir, "test.csv", CsvFixtures.TEST);

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("ideal.csv");
    }

    @Test
    @DisplayName("Should fail when a training column is missing")
    void shouldFailOnMissingColumn() throws IOException {
        CsvFixtures.writeAll(dir);
        CsvFixtures.write(dir, "train.csv", "x,y1,y2,y3\n0,1,2,3\n");

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("y4");
    }

    @Test
    @DisplayName("Should report the row of a non-numeric value")
    void shouldFailOnInvalidNumber() throws IOException {
        CsvFixtures.writeAll(dir);
        CsvFixtures.write(dir, "test.csv", "x,y\n1.0,2.0\n1.0,abc\n");

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("abc")
                .hasMessageContaining("row 2");
    }

    @Test
    @DisplayName("Should reject non-finite values")
    void shouldFailOnNaN() throws IOException {
        CsvFixtures.writeAll(dir);
        CsvFixtures.write(dir, "ideal.csv", "x,y1\n0.0,NaN\n1.0,0\n2.0,0\n");

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("Non-finite");
    }

    @Test
    @DisplayName("Should reject an ideal table on a different grid")
    void shouldFailOnGridMismatch() throws IOException {
        CsvFixtures.writeAll(dir);
        CsvFixtures.write(dir, "ideal.csv", "x,y1\n0.0,1\n1.0,1\n");

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("2 row(s)")
                .hasMessageContaining("3 point(s)");
    }

    @Test
    @DisplayName("Should reject a training x column that is not increasing")
    void shouldFailOnUnorderedGrid() throws IOException {
        CsvFixtures.writeAll(dir);
        CsvFixtures.write(dir, "train.csv", "x,y1,y2,y3,y4\n1,0,0,0,0\n0,0,0,0,0\n");

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("not a valid grid");
    }

    @Test
    @DisplayName("Should reject a table with a header but no data")
    void shouldFailOnEmptyTable() throws IOException {
        CsvFixtures.writeAll(dir);
        CsvFixtures.write(dir, "test.csv", "x,y\n");

        assertThatThrownBy(this::load)
                .isInstanceOf(DataLoadException.class)
                .hasMessageContaining("No data rows");
    }

    private SeriesStore load() {
        return loader.load(dir.resolve("train.csv"), dir.resolve("ideal.csv"), dir.resolve("test.csv"));
    }
}
