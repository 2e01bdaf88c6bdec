package com.meshci.orchestrator.diagnostics;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * @param timelineCommand generator printing an SVG timeline of the node logs on stdout
 * @param workingDir      directory the generator runs in (it is usually a repo script)
 * @param timeout         limit for each capture step
 */
public record DiagnosticsSettings(List<String> timelineCommand, Path workingDir, Duration timeout) {

    public DiagnosticsSettings {
        timelineCommand = timelineCommand == null ? List.of() : List.copyOf(timelineCommand);
    }
}
