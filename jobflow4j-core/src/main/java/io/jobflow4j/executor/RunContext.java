package io.jobflow4j.executor;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Per-run settings handed to a {@link CommandRunner}.
 *
 * @param timeout         bound for subprocess and HTTP commands
 * @param processListener told about a spawned subprocess so it can be cancelled
 */
public record RunContext(Duration timeout, Consumer<Process> processListener) {

    public RunContext {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(processListener, "processListener must not be null");
    }

    public static RunContext of(Duration timeout) {
        return new RunContext(timeout, p -> {
        });
    }
}
