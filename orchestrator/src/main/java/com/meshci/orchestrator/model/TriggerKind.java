package com.meshci.orchestrator.model;

/** VCS event types that start a Run. */
public enum TriggerKind {
    PUSH,
    PULL_REQUEST
}
