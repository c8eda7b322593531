package com.rankfusion.memory.model;

import java.util.List;

/**
 * The fields of a tracked record that long-term memory keeps.
 */
public record SubjectSnapshot(
        String appId,
        String company,
        String role,
        String status,
        String applicationMethod,
        List<String> tags,
        String notes
) {
    public SubjectSnapshot {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
