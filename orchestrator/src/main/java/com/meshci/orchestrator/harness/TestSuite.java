package com.meshci.orchestrator.harness;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * A test command run against a converged network.
 *
 * @param logFilter RUST_LOG for the test process
 * @param env       extra environment variables
 */
public record TestSuite(
        String              name,
        List<String>        command,
        Duration            timeout,
        String              logFilter,
        Map<String, String> env
) {
    public TestSuite {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("suite name cannot be empty");
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("suite command required: " + name);
        command = List.copyOf(command);
        env     = env == null ? Map.of() : Map.copyOf(env);
    }
}
