package com.meshci.orchestrator.build;

import java.util.List;

/**
 * A release binary and the command that compiles it.
 *
 * @param name    file name under {@code target/<triple>/release/}
 * @param command compile command, run in the source workspace
 */
public record BinaryTarget(String name, List<String> command) {

    public BinaryTarget {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("binary name cannot be empty");
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("compile command required for " + name);
        command = List.copyOf(command);
    }
}
