package com.meshci.orchestrator.process;

/**
 * Result of a finished (or killed) command.
 *
 * @param exitCode process exit code; -1 when the command timed out
 * @param output   merged stdout/stderr, empty when it was written to a file
 */
public record CommandResult(int exitCode, String output, boolean timedOut, long elapsedMs) {

    private static final int MAX_SUMMARY_CHARS = 512;

    public boolean success() {
        return !timedOut && exitCode == 0;
    }

    /** Single-line tail of the output, short enough for a step failure message. */
    public String summary() {
        if (output == null) return "";
        String normalized = output.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_SUMMARY_CHARS) return normalized;
        return "..." + normalized.substring(normalized.length() - MAX_SUMMARY_CHARS);
    }

    /**
     * @throws CommandException unless the command exited 0 within its timeout
     */
    public CommandResult requireSuccess(String what) {
        if (timedOut) {
            throw new CommandException(what + " timed out after " + elapsedMs + " ms");
        }
        if (exitCode != 0) {
            throw new CommandException(what + " exited with " + exitCode + ": " + summary());
        }
        return this;
    }
}
