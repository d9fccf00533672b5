package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;

import java.util.Map;

public record ChangeSetSummary(
        int totalChanges,
        int notifiableChanges,
        Map<ChangeKind, Integer> byKind,
        Map<Priority, Integer> byPriority,
        Map<String, Integer> byCategory,
        int orphanCount,
        int truncatedCount,
        boolean hasHighPriority
) {
}
