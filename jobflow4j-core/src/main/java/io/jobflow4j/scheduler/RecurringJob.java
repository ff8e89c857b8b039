package io.jobflow4j.scheduler;

import io.jobflow4j.core.Job;

import java.time.Instant;

/**
 * A recurring definition: the template is cloned into the queue at every {@code nextRun}.
 */
public record RecurringJob(
        Job template,
        String cronExpression,
        Instant nextRun
) {

    RecurringJob withNextRun(Instant next) {
        return new RecurringJob(template, cronExpression, next);
    }
}
