package com.libragraph.folio.core.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * JSON form of a batch run: one object per job, in submission order.
 */
public final class BatchReport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private BatchReport() {
    }

    /**
     * Report line for one job; drops the stack trace.
     */
    public record Entry(int jobId, String input, String output, BatchStatus status,
                        String errorKind, String message, Optional<String> path, Optional<String> filter,
                        Duration elapsed) {

        static Entry of(BatchResult result) {
            JobError error = result.error().orElse(null);
            return new Entry(
                    result.jobId(),
                    result.input().toString(),
                    result.output().toString(),
                    result.status(),
                    error != null && error.kind() != null ? error.kind().label() : null,
                    error != null ? error.message() : null,
                    Optional.ofNullable(error != null ? error.path() : null),
                    Optional.ofNullable(error != null ? error.filter() : null),
                    result.elapsed());
        }
    }

    public static List<Entry> entries(List<BatchResult> results) {
        return results.stream().map(Entry::of).toList();
    }

    public static String toJson(List<BatchResult> results) {
        try {
            return MAPPER.writeValueAsString(entries(results));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(List<BatchResult> results, Path target) {
        try {
            MAPPER.writeValue(target.toFile(), entries(results));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write batch report " + target, e);
        }
    }
}
