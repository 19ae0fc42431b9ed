package com.libragraph.folio.core.batch;

import com.libragraph.folio.markup.DocumentCache;
import com.libragraph.folio.store.PackageIOException;
import com.libragraph.folio.store.PackageStore;
import com.libragraph.folio.store.PackageStores;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many jobs through their pipelines on a bounded worker pool.
 *
 * <p>Each job opens its own isolated store and document cache, so jobs share nothing
 * but the submission queue. A failing job yields a {@link BatchStatus#FAILED} result
 * and never affects its siblings. Results come back in submission order.
 *
 * <p>An orchestrator runs once: {@link #submit} after {@link #runAll} has begun fails.
 */
public class BatchOrchestrator {

    private static final Logger log = Logger.getLogger(BatchOrchestrator.class);

    private final int width;
    private final Optional<Duration> timeout;
    private final boolean xmlCache;
    private final List<JobTicket> queue = new ArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean();

    public BatchOrchestrator(int width, Optional<Duration> timeout, boolean xmlCache) {
        if (width < 1) {
            throw new IllegalArgumentException("Batch width must be at least 1: " + width);
        }
        this.width = width;
        this.timeout = timeout;
        this.xmlCache = xmlCache;
    }

    public BatchOrchestrator(int width) {
        this(width, Optional.empty(), true);
    }

    public int width() {
        return width;
    }

    public JobTicket submit(BatchJob job) {
        synchronized (queue) {
            if (started.get()) {
                throw new IllegalStateException("Batch already started; cannot submit " + job.input());
            }
            JobTicket ticket = new JobTicket(queue.size(), job);
            queue.add(ticket);
            log.debugf("Submitted job %d: %s → %s", ticket.id(), job.input(), job.output());
            return ticket;
        }
    }

    /**
     * Runs every submitted job, at most {@code width} at a time, and waits for all of
     * them. Jobs cancelled before they start are reported as cancelled.
     */
    public List<BatchResult> runAll() {
        List<JobTicket> tickets;
        synchronized (queue) {
            if (!started.compareAndSet(false, true)) {
                throw new IllegalStateException("Batch already started");
            }
            tickets = List.copyOf(queue);
        }
        log.infof("Running %d jobs with width %d", tickets.size(), width);

        ExecutorService pool = Executors.newFixedThreadPool(width, workerThreads());
        try {
            List<BatchResult> results = new ArrayList<>(Multi.createFrom().iterable(tickets)
                    .onItem().transformToUni(ticket -> schedule(ticket, pool))
                    .merge(width)
                    .collect().asList()
                    .await().indefinitely());
            results.sort(Comparator.comparingInt(BatchResult::jobId));

            long failed = results.stream().filter(r -> !r.succeeded()).count();
            log.infof("Batch finished: %d jobs, %d not succeeded", results.size(), failed);
            return results;
        } finally {
            // abandoned jobs finish in the background and discard their output
            pool.shutdown();
        }
    }

    private Uni<BatchResult> schedule(JobTicket ticket, ExecutorService pool) {
        Uni<BatchResult> uni = Uni.createFrom().item(() -> execute(ticket)).runSubscriptionOn(pool);
        if (timeout.isEmpty()) {
            return uni;
        }
        Duration limit = timeout.get();
        return uni.ifNoItem().after(limit).recoverWithItem(() -> {
            if (ticket.abandon()) {
                log.warnf("Job %d timed out after %s: %s", ticket.id(), limit, ticket.job().input());
                return BatchResult.timedOut(ticket, limit);
            }
            return ticket.isCancelled() ? BatchResult.cancelled(ticket) : BatchResult.succeeded(ticket, limit);
        });
    }

    BatchResult execute(JobTicket ticket) {
        if (!ticket.start()) {
            log.infof("Job %d cancelled: %s", ticket.id(), ticket.job().input());
            return BatchResult.cancelled(ticket);
        }
        BatchJob job = ticket.job();
        long begin = System.nanoTime();
        try {
            Path temp = runPipeline(job);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - begin);
            if (!ticket.commit(() -> publish(temp, job.output()))) {
                deleteQuietly(temp);
                log.debugf("Discarded output of abandoned job %d", ticket.id());
                return BatchResult.timedOut(ticket, timeout.orElse(elapsed));
            }
            log.infof("Job %d succeeded in %d ms: %s", ticket.id(), elapsed.toMillis(), job.output());
            return BatchResult.succeeded(ticket, elapsed);
        } catch (RuntimeException e) {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - begin);
            JobError error = JobError.from(e);
            log.warnf("Job %d failed (%s): %s", ticket.id(),
                    error.kind() != null ? error.kind().label() : error.exceptionType(), e.getMessage());
            return BatchResult.failed(ticket, error, elapsed);
        }
    }

    private Path runPipeline(BatchJob job) {
        try (PackageStore store = PackageStores.openIsolated(job.input(), job.backend());
             DocumentCache cache = new DocumentCache(store, xmlCache)) {
            job.pipeline().run(store, cache);
            Path temp = tempFor(job.output());
            try {
                store.exportArchive(temp);
            } catch (RuntimeException e) {
                deleteQuietly(temp);
                throw e;
            }
            return temp;
        }
    }

    private static Path tempFor(Path output) {
        Path dir = output.toAbsolutePath().getParent();
        try {
            Files.createDirectories(dir);
            return Files.createTempFile(dir, ".folio-", ".tmp");
        } catch (IOException e) {
            throw new PackageIOException("Cannot create temporary output next to " + output, e);
        }
    }

    private static void publish(Path temp, Path output) {
        try {
            Files.move(temp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new PackageIOException("Cannot move output into place: " + output, e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf("Cannot delete temporary file %s: %s", path, e.getMessage());
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "folio-batch-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
