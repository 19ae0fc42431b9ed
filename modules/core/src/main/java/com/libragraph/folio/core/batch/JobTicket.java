package com.libragraph.folio.core.batch;

/**
 * Handle on a submitted job.
 *
 * <p>State moves PENDING → STARTED → COMMITTED or ABANDONED, or PENDING → CANCELLED.
 * The job's output is published only on the move to COMMITTED; a timed-out job is
 * ABANDONED and whatever it produces afterwards is discarded.
 */
public class JobTicket {

    enum State { PENDING, STARTED, COMMITTED, ABANDONED, CANCELLED }

    private final int id;
    private final BatchJob job;
    private State state = State.PENDING;

    JobTicket(int id, BatchJob job) {
        this.id = id;
        this.job = job;
    }

    public int id() {
        return id;
    }

    public BatchJob job() {
        return job;
    }

    /**
     * Cancels the job if it has not started.
     *
     * @return true if the job will not run
     */
    public synchronized boolean cancel() {
        if (state == State.PENDING) {
            state = State.CANCELLED;
        }
        return state == State.CANCELLED;
    }

    public synchronized boolean isCancelled() {
        return state == State.CANCELLED;
    }

    synchronized State state() {
        return state;
    }

    synchronized boolean start() {
        if (state != State.PENDING) {
            return false;
        }
        state = State.STARTED;
        return true;
    }

    /**
     * Runs {@code publish} and marks the job committed, unless it was abandoned.
     */
    synchronized boolean commit(Runnable publish) {
        if (state != State.STARTED) {
            return false;
        }
        publish.run();
        state = State.COMMITTED;
        return true;
    }

    /**
     * @return false if the job committed or was cancelled first
     */
    synchronized boolean abandon() {
        if (state == State.COMMITTED || state == State.CANCELLED) {
            return false;
        }
        state = State.ABANDONED;
        return true;
    }
}
