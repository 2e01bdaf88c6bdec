package com.meshci.orchestrator.process;

/**
 * Thrown when an external command cannot be started or exits unsuccessfully.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
