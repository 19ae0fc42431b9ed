package com.libragraph.folio.core.batch;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one job; {@code error} is present for every status but
 * {@link BatchStatus#SUCCEEDED}.
 */
public record BatchResult(
        int jobId,
        Path input,
        Path output,
        BatchStatus status,
        Optional<JobError> error,
        Duration elapsed
) {
    static BatchResult succeeded(JobTicket ticket, Duration elapsed) {
        return new BatchResult(ticket.id(), ticket.job().input(), ticket.job().output(),
                BatchStatus.SUCCEEDED, Optional.empty(), elapsed);
    }

    static BatchResult failed(JobTicket ticket, JobError error, Duration elapsed) {
        return new BatchResult(ticket.id(), ticket.job().input(), ticket.job().output(),
                BatchStatus.FAILED, Optional.of(error), elapsed);
    }

    static BatchResult cancelled(JobTicket ticket) {
        return new BatchResult(ticket.id(), ticket.job().input(), ticket.job().output(),
                BatchStatus.CANCELLED, Optional.of(JobError.cancelled()), Duration.ZERO);
    }

    static BatchResult timedOut(JobTicket ticket, Duration limit) {
        return new BatchResult(ticket.id(), ticket.job().input(), ticket.job().output(),
                BatchStatus.TIMED_OUT, Optional.of(JobError.timeout(limit)), limit);
    }

    public boolean succeeded() {
        return status == BatchStatus.SUCCEEDED;
    }
}
