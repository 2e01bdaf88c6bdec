package com.meshci.orchestrator.network;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Greps node logs for membership records: the "Membership - decided ... Joined"
 * decisions and the "... Left" records that mean a node was dropped.
 *
 * A join pattern with a {@code node} group counts distinct captured node
 * ids, so one elder logging the joins of its peers counts every peer. A
 * pattern without the group counts the distinct log sources that matched.
 */
public class MembershipLog {

    public static final String DEFAULT_JOIN_PATTERN  = "Membership - decided.*Joined\\((?<node>[^)]+)\\)";
    public static final String DEFAULT_LEAVE_PATTERN = "Membership - decided.*Left";

    private static final String NODE_GROUP = "node";

    private final Pattern joinPattern;
    private final Pattern leavePattern;
    private final boolean capturesNode;

    public MembershipLog(String joinPattern, String leavePattern) {
        this.joinPattern  = Pattern.compile(joinPattern);
        this.leavePattern = Pattern.compile(leavePattern);
        this.capturesNode = joinPattern.contains("(?<" + NODE_GROUP + ">");
    }

    public MembershipSnapshot scan(LogSource source) {
        Set<String>   joined     = new HashSet<>();
        List<LogLine> departures = new ArrayList<>();
        for (LogLine line : source.lines()) {
            Matcher join = joinPattern.matcher(line.text());
            if (join.find()) {
                joined.add(capturesNode ? join.group(NODE_GROUP) : line.source());
            }
            if (leavePattern.matcher(line.text()).find()) {
                departures.add(line);
            }
        }
        return new MembershipSnapshot(joined, departures);
    }
}
