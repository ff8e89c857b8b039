package io.jobflow4j.core;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return next == RUNNING || next == CANCELLED;
        }
    },
    RUNNING {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return next == COMPLETED || next == FAILED || next == CANCELLED;
        }
    },
    COMPLETED {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return false;
        }
    },
    FAILED {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return next == RETRY;
        }
    },
    CANCELLED {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return false;
        }
    },
    /**
     * Failed, waiting to re-enter the queue.
     */
    RETRY {
        @Override
        public boolean canTransitionTo(JobStatus next) {
            return next == PENDING || next == CANCELLED;
        }
    };

    private static final Set<JobStatus> CLEANUP_ELIGIBLE = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public abstract boolean canTransitionTo(JobStatus next);

    /**
     * Statuses that {@code cleanup} is allowed to delete. A FAILED job only stays in this state once
     * its retries are exhausted, so it counts as finished here.
     */
    public static Set<JobStatus> cleanupEligible() {
        return EnumSet.copyOf(CLEANUP_ELIGIBLE);
    }

    public boolean isCleanupEligible() {
        return CLEANUP_ELIGIBLE.contains(this);
    }
}
