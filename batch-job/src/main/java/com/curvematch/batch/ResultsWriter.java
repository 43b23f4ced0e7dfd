package com.curvematch.batch;

import com.curvematch.core.engine.MatchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Writes a {@link MatchResult} as a JSON {@link ResultsDocument}.
 *
 * <p>
 * Parent directories are created as needed; an existing file is replaced.
 * </p>
 *
 * @since 1.0.0
 */
public class ResultsWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ResultsWriter.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public ResultsWriter() {
        this(Clock.systemUTC());
    }

    ResultsWriter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param result a completed match run
     * @param target output file
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(MatchResult result, Path target) {
        Objects.requireNonNull(result, "MatchResult must not be null");
        Objects.requireNonNull(target, "Target path must not be null");

        ResultsDocument document = ResultsDocument.from(result, Instant.now(clock));
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), document);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write results to " + target, e);
        }
        LOG.info("Wrote {} selection(s) and {} observation(s) to {}",
                document.getSelections().size(), document.getObservations().size(), target);
    }
}
