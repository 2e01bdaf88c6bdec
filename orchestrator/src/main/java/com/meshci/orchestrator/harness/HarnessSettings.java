package com.meshci.orchestrator.harness;

import java.nio.file.Path;
import java.time.Duration;

/**
 * @param workspace    source checkout the suites run in
 * @param startTimeout limit for preparing and launching the network
 * @param checkTimeout limit for the short post-test checks and teardown
 */
public record HarnessSettings(Path workspace, Duration startTimeout, Duration checkTimeout) {}
