package com.meshci.orchestrator.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Spawns external commands: compile commands, the bootstrap and node
 * binaries, test suites, git and the timeline generator.
 *
 * Output is always redirected to a file rather than read from a pipe, so a
 * chatty child can never block on a full pipe buffer. stderr is merged into
 * stdout unless the spec names a separate error file.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /**
     * Run a command to completion.
     *
     * On timeout the process tree is killed and the result has
     * {@code timedOut = true}. If the calling thread is interrupted (the step
     * was cancelled) the tree is killed and the interrupt is re-asserted.
     *
     * @throws CommandException if the command cannot be started or the wait is interrupted
     */
    public CommandResult run(CommandSpec spec) {
        Path capture = null;
        try {
            if (spec.outputFile() == null) {
                capture = Files.createTempFile("meshci-cmd-", ".out");
            }
            Path out = spec.outputFile() != null ? spec.outputFile() : capture;

            log.debug("Running: {}", spec.display());
            long start = System.nanoTime();
            Process process = spawn(spec, out);

            boolean finished;
            try {
                finished = process.waitFor(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                destroyTree(process);
                Thread.currentThread().interrupt();
                throw new CommandException("Interrupted while running: " + spec.display(), e);
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            if (!finished) {
                log.warn("Command timed out after {} ms, killing: {}", elapsedMs, spec.display());
                destroyTree(process);
            }
            String output = capture != null ? Files.readString(capture, StandardCharsets.UTF_8) : "";
            int exit = finished ? process.exitValue() : -1;
            log.debug("Command exited {} in {} ms: {}", exit, elapsedMs, spec.display());
            return new CommandResult(exit, output, !finished, elapsedMs);
        } catch (IOException e) {
            throw new CommandException("Failed to run: " + spec.display(), e);
        } finally {
            if (capture != null) {
                try {
                    Files.deleteIfExists(capture);
                } catch (IOException e) {
                    log.debug("Could not delete capture file {}: {}", capture, e.getMessage());
                }
            }
        }
    }

    /**
     * Start a long-lived command (the bootstrap binary, extra nodes) and
     * return immediately. Output goes to {@code spec.outputFile()} or is
     * discarded.
     */
    public Process start(CommandSpec spec) {
        try {
            log.info("Starting: {}", spec.display());
            return spawn(spec, spec.outputFile());
        } catch (IOException e) {
            throw new CommandException("Failed to start: " + spec.display(), e);
        }
    }

    /** Forcibly kill a process and every descendant. */
    public static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Process spawn(CommandSpec spec, Path out) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(spec.command()));
        if (spec.workingDir() != null) {
            pb.directory(spec.workingDir().toFile());
        }
        pb.environment().putAll(spec.env());
        if (spec.errorFile() != null) {
            createParent(spec.errorFile());
            pb.redirectError(ProcessBuilder.Redirect.appendTo(spec.errorFile().toFile()));
        } else {
            pb.redirectErrorStream(true);
        }
        if (out != null) {
            createParent(out);
            pb.redirectOutput(ProcessBuilder.Redirect.appendTo(out.toFile()));
        } else {
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }
        return pb.start();
    }

    private static void createParent(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
    }
}
