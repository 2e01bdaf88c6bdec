package com.meshci.orchestrator.model;

/**
 * A push or pull-request event as delivered by the VCS webhook.
 *
 * @param kind              PUSH or PULL_REQUEST
 * @param workflow          workflow name, e.g. "pr-checks" or "merge"
 * @param ref               git ref, e.g. "refs/heads/main" or "refs/pull/42/merge"
 * @param headCommitMessage message of the head commit (push events)
 * @param prTitle           pull-request title (pull-request events, may be null)
 * @param prNumber          pull-request number (pull-request events, may be null)
 * @param actor             user who triggered the event
 * @param repositoryOwner   owner of the repository the event belongs to
 */
public record TriggerEvent(
        TriggerKind kind,
        String      workflow,
        String      ref,
        String      headCommitMessage,
        String      prTitle,
        Integer     prNumber,
        String      actor,
        String      repositoryOwner
) {

    public TriggerEvent {
        if (kind == null)     throw new IllegalArgumentException("kind is required");
        if (workflow == null || workflow.isBlank()) throw new IllegalArgumentException("workflow is required");
        if (ref == null || ref.isBlank())           throw new IllegalArgumentException("ref is required");
        if (headCommitMessage == null) headCommitMessage = "";
    }

    /**
     * Concurrency group: one active Run per workflow and PR number (or ref when
     * the event is not a pull request).
     */
    public String concurrencyGroup() {
        return workflow + "-" + (prNumber != null ? "pr" + prNumber : ref);
    }

    public static TriggerEvent push(String workflow, String ref, String message, String actor, String owner) {
        return new TriggerEvent(TriggerKind.PUSH, workflow, ref, message, null, null, actor, owner);
    }

    public static TriggerEvent pullRequest(String workflow, int prNumber, String title, String actor, String owner) {
        return new TriggerEvent(TriggerKind.PULL_REQUEST, workflow, "refs/pull/" + prNumber + "/merge",
                "", title, prNumber, actor, owner);
    }
}
