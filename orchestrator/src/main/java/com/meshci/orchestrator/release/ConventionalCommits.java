package com.meshci.orchestrator.release;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the version bump from conventional commit messages.
 *
 * <ul>
 *   <li>breaking ({@code type!:} or a {@code BREAKING CHANGE:} footer) → major</li>
 *   <li>{@code feat} → minor</li>
 *   <li>anything else → patch</li>
 * </ul>
 * Below 1.0.0 everything shifts down one level: breaking → minor and
 * {@code feat} → patch.
 */
public final class ConventionalCommits {

    private static final Pattern HEADER   = Pattern.compile("^(\\w+)(?:\\([^)]*\\))?(!)?:\\s*\\S");
    private static final Pattern BREAKING = Pattern.compile("(?m)^BREAKING[ -]CHANGE:");

    private ConventionalCommits() {}

    /** Bump implied by one message, ignoring the 0.x rule. */
    public static BumpLevel classify(String message) {
        if (message == null || message.isBlank()) return BumpLevel.NONE;
        String trimmed = message.strip();
        Matcher header = HEADER.matcher(trimmed);
        if (!header.find()) {
            return hasBreakingFooter(trimmed) ? BumpLevel.MAJOR : BumpLevel.PATCH;
        }
        if (header.group(2) != null || hasBreakingFooter(trimmed)) return BumpLevel.MAJOR;
        return "feat".equalsIgnoreCase(header.group(1)) ? BumpLevel.MINOR : BumpLevel.PATCH;
    }

    /** Highest bump over all messages, adjusted for pre-1.0 versions. */
    public static BumpLevel level(List<String> messages, SemanticVersion current) {
        BumpLevel level = BumpLevel.NONE;
        for (String message : messages) {
            level = level.max(classify(message));
        }
        if (current.isPreStable()) {
            level = switch (level) {
                case MAJOR -> BumpLevel.MINOR;
                case MINOR -> BumpLevel.PATCH;
                default    -> level;
            };
        }
        return level;
    }

    private static boolean hasBreakingFooter(String message) {
        return BREAKING.matcher(message).find();
    }
}
