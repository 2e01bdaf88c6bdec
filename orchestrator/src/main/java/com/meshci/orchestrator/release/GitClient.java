package com.meshci.orchestrator.release;

import com.meshci.orchestrator.process.CommandResult;
import com.meshci.orchestrator.process.CommandSpec;
import com.meshci.orchestrator.process.ProcessRunner;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The handful of git operations the release step needs, run through the
 * git CLI in one working copy.
 *
 * Credentials travel in GIT_CONFIG_* environment variables so they never
 * appear on a command line or in a log.
 */
public class GitClient {

    private static final String RECORD_SEPARATOR = "\u001e";

    private final ProcessRunner processRunner;
    private final Path          repoDir;
    private final Duration      timeout;
    private final String        authorName;
    private final String        authorEmail;

    public GitClient(ProcessRunner processRunner, Path repoDir, Duration timeout,
                     String authorName, String authorEmail) {
        this.processRunner = processRunner;
        this.repoDir       = repoDir;
        this.timeout       = timeout;
        this.authorName    = authorName;
        this.authorEmail   = authorEmail;
    }

    /** Reset the working copy to the tip of {@code remote/branch}, fetching its tags. */
    public void syncTo(String remote, String branch, String token) {
        git(auth(token), "fetch", "--tags", "--force", remote, branch).requireSuccess("git fetch");
        git(Map.of(), "reset", "--hard", "FETCH_HEAD").requireSuccess("git reset");
    }

    /** Most recent tag reachable from HEAD that starts with {@code prefix}. */
    public Optional<String> latestTag(String prefix) {
        CommandResult result = git(Map.of(), "describe", "--tags", "--abbrev=0", "--match", prefix + "*");
        if (!result.success()) {
            return Optional.empty();
        }
        String tag = result.output().strip();
        return tag.isEmpty() ? Optional.empty() : Optional.of(tag);
    }

    /** Full messages of the commits after {@code since} (or of all commits), newest first. */
    public List<String> commitMessagesSince(Optional<String> since) {
        String range = since.map(tag -> tag + "..HEAD").orElse("HEAD");
        String out = git(Map.of(), "log", "--format=%B%x1e", range)
                .requireSuccess("git log").output();
        List<String> messages = new ArrayList<>();
        for (String message : out.split(RECORD_SEPARATOR)) {
            if (!message.isBlank()) {
                messages.add(message.strip());
            }
        }
        return messages;
    }

    public void commit(String message, List<Path> files) {
        List<String> add = new ArrayList<>(List.of("add", "--"));
        files.forEach(f -> add.add(repoDir.relativize(f.toAbsolutePath()).toString()));
        git(Map.of(), add.toArray(String[]::new)).requireSuccess("git add");
        git(identity(), "commit", "-m", message).requireSuccess("git commit");
    }

    public void tag(String tag, String message) {
        git(identity(), "tag", "-a", tag, "-m", message).requireSuccess("git tag");
    }

    public void deleteTag(String tag) {
        git(Map.of(), "tag", "-d", tag).requireSuccess("git tag -d");
    }

    /** Push HEAD to {@code branch} together with its annotated tags. */
    public void push(String remote, String branch, String token) {
        git(auth(token), "push", "--follow-tags", remote, "HEAD:refs/heads/" + branch)
                .requireSuccess("git push");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private CommandResult git(Map<String, String> env, String... args) {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(Arrays.asList(args));
        return processRunner.run(CommandSpec.of(command).in(repoDir).withEnv(env).withTimeout(timeout));
    }

    private Map<String, String> identity() {
        Map<String, String> env = new HashMap<>();
        env.put("GIT_AUTHOR_NAME",     authorName);
        env.put("GIT_AUTHOR_EMAIL",    authorEmail);
        env.put("GIT_COMMITTER_NAME",  authorName);
        env.put("GIT_COMMITTER_EMAIL", authorEmail);
        return env;
    }

    private static Map<String, String> auth(String token) {
        if (token == null || token.isBlank()) {
            return Map.of();
        }
        String basic = Base64.getEncoder().encodeToString(
                ("x-access-token:" + token).getBytes(StandardCharsets.UTF_8));
        return Map.of(
                "GIT_CONFIG_COUNT",   "1",
                "GIT_CONFIG_KEY_0",   "http.extraHeader",
                "GIT_CONFIG_VALUE_0", "Authorization: Basic " + basic);
    }
}
