package io.jobflow4j.core;

import io.jobflow4j.JobFunction;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class JobFunctionRegistry {

    private final Map<String, JobFunction> functionsByName;

    public JobFunctionRegistry(List<JobFunction> functions) {
        this.functionsByName = functions.stream()
                .collect(Collectors.toUnmodifiableMap(
                        JobFunction::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate JobFunction name: " + a.name());
                        }
                ));
    }

    public static JobFunctionRegistry empty() {
        return new JobFunctionRegistry(List.of());
    }

    public Optional<JobFunction> find(String name) {
        return Optional.ofNullable(functionsByName.get(name));
    }

    public Set<String> names() {
        return functionsByName.keySet();
    }
}
