package io.jobflow4j.core;

/**
 * Result of an executor-level cancellation.
 *
 * futureCancelled : the job had not started yet and will never run
 * processKilled   : a subprocess running the job was terminated
 * dequeued        : the job was still waiting in the queue and was removed
 * markedCancelled : an in-flight job was flagged so its outcome is discarded
 */
public record CancelResult(
        boolean futureCancelled,
        boolean processKilled,
        boolean dequeued,
        boolean markedCancelled
) {

    public static CancelResult empty() {
        return new CancelResult(false, false, false, false);
    }

    public boolean hasEffect() {
        return futureCancelled || processKilled || dequeued || markedCancelled;
    }
}
