package com.meshci.orchestrator.network;

/**
 * One line of a node log.
 *
 * @param source id of the node that wrote it (its directory under the log root)
 */
public record LogLine(String source, String text) {}
