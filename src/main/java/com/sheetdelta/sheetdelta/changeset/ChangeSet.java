package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Ordered result of one change computation: priority descending, then path, then kind.
 */
public record ChangeSet(List<ChangeEntry> entries) {

    public ChangeSet {
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of());
    }

    /**
     * Entries meant for notifications, i.e. everything not classified {@link Priority#IGNORED}.
     */
    public List<ChangeEntry> notifiable() {
        return entries.stream().filter(entry -> entry.priority().isNotifiable()).toList();
    }

    public List<ChangeEntry> atOrAbove(Priority threshold) {
        return entries.stream().filter(entry -> entry.priority().isAtLeast(threshold)).toList();
    }

    /**
     * Groups entries by the top-level key of their path, keeping the set's order inside each group.
     */
    public Map<String, List<ChangeEntry>> byCategory() {
        Map<String, List<ChangeEntry>> grouped = new TreeMap<>();
        for (ChangeEntry entry : entries) {
            grouped.computeIfAbsent(entry.change().category(), key -> new ArrayList<>()).add(entry);
        }
        Map<String, List<ChangeEntry>> frozen = new LinkedHashMap<>();
        grouped.forEach((category, group) -> frozen.put(category, List.copyOf(group)));
        return frozen;
    }

    /**
     * Entries directly explained by the given change.
     */
    public List<ChangeEntry> effectsOf(FieldChange cause) {
        return entries.stream()
                .filter(entry -> entry.link() != null && entry.link().cause().equals(cause))
                .toList();
    }

    public List<ChangeEntry> orphans() {
        return entries.stream().filter(ChangeEntry::orphan).toList();
    }

    public ChangeSetSummary summary() {
        Map<ChangeKind, Integer> byKind = new EnumMap<>(ChangeKind.class);
        Map<Priority, Integer> byPriority = new EnumMap<>(Priority.class);
        Map<String, Integer> byCategory = new TreeMap<>();
        int notifiable = 0;
        int orphans = 0;
        int truncated = 0;
        boolean high = false;

        for (ChangeEntry entry : entries) {
            byKind.merge(entry.change().kind(), 1, Integer::sum);
            byPriority.merge(entry.priority(), 1, Integer::sum);
            byCategory.merge(entry.change().category(), 1, Integer::sum);
            if (entry.priority().isNotifiable()) {
                notifiable++;
            }
            if (entry.orphan()) {
                orphans++;
            } else if (entry.link().cascadeTruncated()) {
                truncated++;
            }
            high |= entry.priority() == Priority.HIGH;
        }

        return new ChangeSetSummary(
                entries.size(),
                notifiable,
                Collections.unmodifiableMap(byKind),
                Collections.unmodifiableMap(byPriority),
                Collections.unmodifiableMap(byCategory),
                orphans,
                truncated,
                high
        );
    }
}
