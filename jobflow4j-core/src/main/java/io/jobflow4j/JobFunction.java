package io.jobflow4j;

import java.util.Map;

/**
 * In-process target of a {@code python:<module>[::<function>]} command.
 *
 * <p>{@link #name()} is the registry key, {@code module::function} (function defaults to {@code main}).
 */
public interface JobFunction {
    String name();

    Object call(Map<String, Object> parameters) throws Exception;
}
