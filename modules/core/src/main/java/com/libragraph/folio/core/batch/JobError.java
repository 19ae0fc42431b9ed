package com.libragraph.folio.core.batch;

import com.libragraph.folio.core.filter.FilterFailureException;
import com.libragraph.folio.types.ErrorKind;
import com.libragraph.folio.types.FolioException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;

/**
 * Why a batch job did not succeed.
 *
 * @param kind   taxonomy kind, or null for failures outside the taxonomy
 * @param path   offending entry, or null
 * @param filter name of the failing filter, or null
 */
public record JobError(
        String message,
        String exceptionType,
        ErrorKind kind,
        String path,
        String filter,
        String stackTrace
) {
    public static JobError from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        ErrorKind kind = null;
        String path = null;
        String filter = null;
        if (t instanceof FolioException folio) {
            kind = folio.kind();
            path = folio.path().orElse(null);
        } else if (t instanceof UncheckedIOException) {
            kind = ErrorKind.IO_FAILURE;
        }
        if (t instanceof FilterFailureException failure) {
            filter = failure.filterName();
        }

        return new JobError(
                t.getMessage(),
                t.getClass().getName(),
                kind,
                path,
                filter,
                sw.toString()
        );
    }

    public static JobError timeout(Duration limit) {
        return new JobError("Job exceeded " + limit, null, ErrorKind.TIMEOUT, null, null, null);
    }

    public static JobError cancelled() {
        return new JobError("Job cancelled before it started", null, ErrorKind.CANCELLED, null, null, null);
    }
}
