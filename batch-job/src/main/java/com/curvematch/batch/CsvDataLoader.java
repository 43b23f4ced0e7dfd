package com.curvematch.batch;

import com.curvematch.core.error.CurveMatchException;
import com.curvematch.core.model.Grid;
import com.curvematch.core.model.SeriesId;
import com.curvematch.core.model.SeriesStore;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the three input tables and assembles a validated {@link SeriesStore}.
 *
 * <h3>Expected tables</h3>
 * <ul>
 * <li>training: {@code x, y1, y2, y3, y4}: the x column becomes the shared
 * grid</li>
 * <li>ideal: {@code x, y1 .. yN}: one candidate curve per y column; the x
 * column must equal the training x column row for row</li>
 * <li>test: {@code x, y}: one observation per row, x need not lie on the
 * grid</li>
 * </ul>
 * <p>
 * Columns are matched by header name; extra columns are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvDataLoader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvDataLoader.class);

    private final CsvMapper mapper;

    public CsvDataLoader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Load all three tables.
     *
     * @param training path to the training table
     * @param ideal    path to the ideal-function table
     * @param test     path to the test table
     * @return the assembled store
     * @throws DataLoadException if any table is missing or malformed
     */
    public SeriesStore load(Path training, Path ideal, Path test) {
        Objects.requireNonNull(training, "Training path must not be null");
        Objects.requireNonNull(ideal, "Ideal path must not be null");
        Objects.requireNonNull(test, "Test path must not be null");

        List<Map<String, String>> trainingRows = readRows(training);
        requireColumns(training, trainingRows, List.of("x", "y1", "y2", "y3", "y4"));
        double[] xs = column(training, trainingRows, "x");

        Grid grid;
        try {
            grid = Grid.of(xs);
        } catch (CurveMatchException e) {
            throw new DataLoadException("Training x column in " + training + " is not a valid grid: "
                    + e.getMessage(), e);
        }

        SeriesStore.Builder builder = SeriesStore.builder(grid);
        for (SeriesId id : SeriesId.values()) {
            builder.measured(id, column(training, trainingRows, id.label()));
        }
        LOG.info("Loaded training data from {}: {} point(s)", training, grid.size());

        List<Map<String, String>> idealRows = readRows(ideal);
        requireColumns(ideal, idealRows, List.of("x", "y1"));
        double[] idealXs = column(ideal, idealRows, "x");
        requireSameGrid(ideal, grid, idealXs);
        int functions = countYColumns(idealRows.get(0).keySet());
        for (int f = 1; f <= functions; f++) {
            builder.candidate(column(ideal, idealRows, "y" + f));
        }
        LOG.info("Loaded ideal functions from {}: {} function(s)", ideal, functions);

        List<Map<String, String>> testRows = readRows(test);
        requireColumns(test, testRows, List.of("x", "y"));
        double[] testXs = column(test, testRows, "x");
        double[] testYs = column(test, testRows, "y");
        for (int i = 0; i < testXs.length; i++) {
            builder.observation(testXs[i], testYs[i]);
        }
        LOG.info("Loaded test data from {}: {} observation(s)", test, testXs.length);

        try {
            return builder.build();
        } catch (CurveMatchException e) {
            throw new DataLoadException("Input tables do not form a valid data set: " + e.getMessage(), e);
        }
    }

    /**
     * Read a headed CSV file into one map per data row.
     *
     * @param path the file
     * @return rows in file order; never empty
     * @throws DataLoadException if the file is missing, unreadable or has no
     *                           data rows
     */
    List<Map<String, String>> readRows(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new DataLoadException("File not found: " + path);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(path.toFile())) {
            List<Map<String, String>> rows = it.readAll();
            if (rows.isEmpty()) {
                throw new DataLoadException("No data rows in " + path);
            }
            return rows;
        } catch (IOException e) {
            throw new DataLoadException("Error loading CSV file " + path + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireColumns(Path path, List<Map<String, String>> rows, List<String> expected) {
        Set<String> missing = new LinkedHashSet<>(expected);
        missing.removeAll(rows.get(0).keySet());
        if (!missing.isEmpty()) {
            throw new DataLoadException("Missing column(s) " + missing + " in " + path
                    + ". Expected: " + expected);
        }
    }

    private static double[] column(Path path, List<Map<String, String>> rows, String name) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            String raw = rows.get(i).get(name);
            if (raw == null || raw.isEmpty()) {
                throw new DataLoadException("Missing value for column '" + name + "' in row " + (i + 1)
                        + " of " + path);
            }
            try {
                values[i] = Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw new DataLoadException("Invalid number '" + raw + "' for column '" + name
                        + "' in row " + (i + 1) + " of " + path, e);
            }
            if (!Double.isFinite(values[i])) {
                throw new DataLoadException("Non-finite value '" + raw + "' for column '" + name
                        + "' in row " + (i + 1) + " of " + path);
            }
        }
        return values;
    }

    private static void requireSameGrid(Path path, Grid grid, double[] xs) {
        if (xs.length != grid.size()) {
            throw new DataLoadException(path + " has " + xs.length + " row(s) but the training grid has "
                    + grid.size() + " point(s)");
        }
        for (int i = 0; i < xs.length; i++) {
            if (Double.compare(xs[i], grid.x(i)) != 0) {
                throw new DataLoadException("x in row " + (i + 1) + " of " + path + " is " + xs[i]
                        + " but the training grid has " + grid.x(i));
            }
        }
    }

    private static int countYColumns(Set<String> header) {
        int n = 0;
        while (header.contains("y" + (n + 1))) {
            n++;
        }
        return n;
    }
}
