package com.sprintsync.workflow.service;

import java.util.List;

/**
 * A complete workflow to install for an organization in one go.
 * Edges name their statuses, which may be new in this setup or already exist.
 */
public record WorkflowSetup(List<StatusDefinition> statuses, List<EdgeDefinition> transitions) {

    public WorkflowSetup {
        statuses    = copyOf(statuses, "statuses");
        transitions = copyOf(transitions, "transitions");
    }

    public record StatusDefinition(String name, String displayName, String color,
                                   int orderIndex, boolean defaultStatus) {}

    public record EdgeDefinition(String from, String to) {}

    private static <T> List<T> copyOf(List<T> entries, String field) {
        if (entries == null) {
            return List.of();
        }
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == null) {
                throw new IllegalArgumentException(field + "[" + i + "] must not be null");
            }
        }
        return List.copyOf(entries);
    }
}
