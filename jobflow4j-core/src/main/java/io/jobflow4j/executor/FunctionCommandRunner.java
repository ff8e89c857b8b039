package io.jobflow4j.executor;

import io.jobflow4j.JobFunction;
import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;
import io.jobflow4j.core.JobFunctionRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs {@code python:} commands by calling the {@link JobFunction} registered under
 * {@code module::function} with the job's parameters.
 */
public class FunctionCommandRunner implements CommandRunner<Command.FunctionCall> {

    private final JobFunctionRegistry registry;

    public FunctionCommandRunner(JobFunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public Map<String, Object> run(Command.FunctionCall command, Job job, RunContext context) throws JobExecutionException {
        JobFunction function = registry.find(command.target())
                .orElseThrow(() -> new JobExecutionException("Function '" + command.function()
                        + "' not found in module '" + command.module() + "'"));

        Object value;
        try {
            value = function.call(job.getParameters());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobExecutionException("Function call interrupted", e);
        } catch (Exception e) {
            throw new JobExecutionException("Function call failed: " + describe(e), e);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("result", value);
        result.put("module", command.module());
        result.put("function", command.function());
        return result;
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
