package io.github.drompincen.sheetbridge.runtime.mapping;

import java.util.List;

/** Result of matching a file's header against a schema: one match per attribute, in schema order. */
public record ColumnMappingPlan(List<ColumnMatch> matches, List<String> unclaimedLabels) {

    public ColumnMappingPlan {
        matches = List.copyOf(matches);
        unclaimedLabels = List.copyOf(unclaimedLabels);
    }

    public List<ColumnMatch> fuzzyMatches() {
        return matches.stream().filter(m -> m.kind() == MatchKind.FUZZY).toList();
    }

    public List<ColumnMatch> unmapped() {
        return matches.stream().filter(m -> !m.isMapped()).toList();
    }

    public long mappedCount() {
        return matches.stream().filter(ColumnMatch::isMapped).count();
    }
}
