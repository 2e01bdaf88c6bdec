package com.meshci.orchestrator.api.dto;

import com.meshci.orchestrator.model.TriggerEvent;
import com.meshci.orchestrator.model.TriggerKind;

/**
 * Request body for POST /runs, a trimmed-down VCS webhook payload.
 *
 * Required: kind, workflow, and either ref (push) or prNumber (pull request).
 */
public record TriggerRequest(
        TriggerKind kind,
        String      workflow,
        String      ref,
        String      headCommitMessage,
        String      prTitle,
        Integer     prNumber,
        String      actor,
        String      repositoryOwner
) {
    public TriggerEvent toEvent() {
        String effectiveRef = ref;
        if ((effectiveRef == null || effectiveRef.isBlank()) && prNumber != null) {
            effectiveRef = "refs/pull/" + prNumber + "/merge";
        }
        return new TriggerEvent(kind, workflow, effectiveRef, headCommitMessage, prTitle, prNumber,
                actor, repositoryOwner);
    }
}
