package io.jobflow4j.executor;

import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Runs {@code shell:} commands through the platform shell.
 *
 * <p>{@code {name}} placeholders are replaced by job parameters; an unknown name fails the job.
 * The child inherits this process' environment, overridden by the {@code env} parameter.
 * Output is captured to temp files so a hung child cannot block on a full pipe. On timeout the
 * whole process tree is destroyed.
 */
public class ShellCommandRunner implements CommandRunner<Command.Shell> {
    private static final Logger log = LoggerFactory.getLogger(ShellCommandRunner.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");
    private static final boolean WINDOWS = System.getProperty("os.name", "").toLowerCase().startsWith("windows");

    @Override
    public Map<String, Object> run(Command.Shell command, Job job, RunContext context) throws JobExecutionException {
        String commandLine = substitute(command.commandLine(), job.getParameters());

        ProcessBuilder pb = WINDOWS
                ? new ProcessBuilder("cmd.exe", "/c", commandLine)
                : new ProcessBuilder("/bin/sh", "-c", commandLine);
        pb.environment().putAll(environmentOverrides(job.getParameters()));

        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("jobflow-", ".out");
            stderrFile = Files.createTempFile("jobflow-", ".err");
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());

            process = pb.start();
            context.processListener().accept(process);
            log.debug("jobflow shell started id={} pid={} cmd={}", job.getId(), process.pid(), commandLine);

            long timeoutSeconds = context.timeout().toSeconds();
            if (!process.waitFor(context.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                throw new JobExecutionException("Command timed out after " + timeoutSeconds + " seconds");
            }

            int exitCode = process.exitValue();
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            if (exitCode != 0) {
                throw new JobExecutionException("Command exited with code " + exitCode
                        + (stderr.isBlank() ? "" : ": " + stderr.strip()));
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("stdout", stdout);
            result.put("stderr", stderr);
            result.put("return_code", exitCode);
            result.put("command", commandLine);
            return result;
        } catch (IOException e) {
            throw new JobExecutionException("Command execution failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            throw new JobExecutionException("Command interrupted", e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    static String substitute(String template, Map<String, Object> parameters) throws JobExecutionException {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            if (!parameters.containsKey(key)) {
                throw new JobExecutionException("Command execution failed: missing parameter '" + key + "'");
            }
            m.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(parameters.get(key))));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static Map<String, String> environmentOverrides(Map<String, Object> parameters) {
        Object env = parameters.get("env");
        if (!(env instanceof Map<?, ?> map)) {
            return Map.of();
        }
        return map.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .collect(Collectors.toMap(e -> e.getKey().toString(), e -> e.getValue().toString()));
    }

    /**
     * Force-kill a process and everything it spawned.
     */
    static void destroyTree(Process process) {
        if (process == null) {
            return;
        }
        List<ProcessHandle> children = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        children.forEach(ProcessHandle::destroyForcibly);
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("jobflow shell could not delete temp file={} msg={}", file, e.getMessage());
        }
    }
}
