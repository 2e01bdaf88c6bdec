package com.meshci.orchestrator.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An external command to run.
 *
 * @param command    argv; the first element is the executable
 * @param workingDir directory to run in, or null for the orchestrator's cwd
 * @param env        variables added to (or overriding) the inherited environment
 * @param timeout    wall-clock limit for {@link ProcessRunner#run}; ignored by {@link ProcessRunner#start}
 * @param outputFile file receiving stdout (appended), or null to capture in memory
 * @param errorFile  file receiving stderr (appended), or null to merge it into the output
 */
public record CommandSpec(
        List<String>        command,
        Path                workingDir,
        Map<String, String> env,
        Duration            timeout,
        Path                outputFile,
        Path                errorFile
) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

    public CommandSpec {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        command = List.copyOf(command);
        env     = env == null ? Map.of() : Map.copyOf(env);
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
    }

    public static CommandSpec of(List<String> command) {
        return new CommandSpec(command, null, Map.of(), DEFAULT_TIMEOUT, null, null);
    }

    public CommandSpec in(Path dir) {
        return new CommandSpec(command, dir, env, timeout, outputFile, errorFile);
    }

    public CommandSpec withEnv(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(env);
        merged.put(key, value);
        return new CommandSpec(command, workingDir, merged, timeout, outputFile, errorFile);
    }

    public CommandSpec withEnv(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(env);
        merged.putAll(extra);
        return new CommandSpec(command, workingDir, merged, timeout, outputFile, errorFile);
    }

    public CommandSpec withTimeout(Duration newTimeout) {
        return new CommandSpec(command, workingDir, env, newTimeout, outputFile, errorFile);
    }

    public CommandSpec writingTo(Path file) {
        return new CommandSpec(command, workingDir, env, timeout, file, errorFile);
    }

    public CommandSpec errorsTo(Path file) {
        return new CommandSpec(command, workingDir, env, timeout, outputFile, file);
    }

    /** The command line as a single string, for logs. */
    public String display() {
        return String.join(" ", command);
    }
}
