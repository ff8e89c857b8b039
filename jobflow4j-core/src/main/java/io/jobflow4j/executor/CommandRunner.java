package io.jobflow4j.executor;

import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;

import java.util.Map;

/**
 * Runs one kind of {@link Command} on behalf of the {@link TaskExecutor}.
 */
public interface CommandRunner<C extends Command> {

    /**
     * @return the success payload stored as the job's result
     * @throws JobExecutionException if the command failed or timed out
     */
    Map<String, Object> run(C command, Job job, RunContext context) throws JobExecutionException;
}
