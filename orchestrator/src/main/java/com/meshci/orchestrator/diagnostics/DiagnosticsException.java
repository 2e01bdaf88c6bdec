package com.meshci.orchestrator.diagnostics;

public class DiagnosticsException extends RuntimeException {

    public DiagnosticsException(String message) {
        super(message);
    }

    public DiagnosticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
