package io.jobflow4j.core;

import java.util.Objects;

/**
 * What a job runs. Decoded once from the tagged string form when the job is created.
 *
 * <ul>
 *   <li>{@code shell:<command line>} (also any untagged string)</li>
 *   <li>{@code python:<module>[::<function>]}: in-process call resolved through the function registry</li>
 *   <li>{@code http:<url>}</li>
 * </ul>
 */
public sealed interface Command permits Command.Shell, Command.FunctionCall, Command.Http {

    String SHELL_TAG = "shell:";
    String FUNCTION_TAG = "python:";
    String HTTP_TAG = "http:";
    String DEFAULT_FUNCTION = "main";

    /**
     * Canonical tagged form; {@code parse(asString())} yields an equal command.
     */
    String asString();

    static Command parse(String raw) {
        Objects.requireNonNull(raw, "command must not be null");
        if (raw.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }

        if (raw.startsWith(FUNCTION_TAG)) {
            return FunctionCall.of(raw.substring(FUNCTION_TAG.length()));
        }
        if (raw.startsWith(SHELL_TAG)) {
            return new Shell(raw.substring(SHELL_TAG.length()));
        }
        if (raw.startsWith(HTTP_TAG)) {
            return Http.of(raw.substring(HTTP_TAG.length()));
        }
        return new Shell(raw);
    }

    record Shell(String commandLine) implements Command {
        public Shell {
            Objects.requireNonNull(commandLine, "commandLine must not be null");
            if (commandLine.isBlank()) {
                throw new IllegalArgumentException("shell command must not be blank");
            }
        }

        @Override
        public String asString() {
            return SHELL_TAG + commandLine;
        }
    }

    record FunctionCall(String module, String function) implements Command {
        public FunctionCall {
            Objects.requireNonNull(module, "module must not be null");
            Objects.requireNonNull(function, "function must not be null");
            if (module.isBlank()) {
                throw new IllegalArgumentException("module must not be blank");
            }
            if (function.isBlank()) {
                throw new IllegalArgumentException("function must not be blank");
            }
        }

        static FunctionCall of(String target) {
            String t = target.trim();
            int sep = t.indexOf("::");
            if (sep < 0) {
                return new FunctionCall(t, DEFAULT_FUNCTION);
            }
            return new FunctionCall(t.substring(0, sep), t.substring(sep + 2));
        }

        /**
         * Registry key of the target, {@code module::function}.
         */
        public String target() {
            return module + "::" + function;
        }

        @Override
        public String asString() {
            return FUNCTION_TAG + target();
        }
    }

    record Http(String url) implements Command {
        public Http {
            Objects.requireNonNull(url, "url must not be null");
            if (url.isBlank()) {
                throw new IllegalArgumentException("url must not be blank");
            }
        }

        // "http://host/x" arrives here as "//host/x" once the tag is stripped
        static Http of(String rest) {
            String r = rest.trim();
            if (r.startsWith("//")) {
                return new Http("http:" + r);
            }
            return new Http(r);
        }

        @Override
        public String asString() {
            if (url.startsWith("http://")) {
                return url;
            }
            return HTTP_TAG + url;
        }
    }
}
