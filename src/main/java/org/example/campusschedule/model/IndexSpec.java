package org.example.campusschedule.model;

import lombok.Getter;

import java.util.List;

/**
 * Ascending index over stored field names (snake_case, as persisted).
 */
@Getter
public final class IndexSpec {

    private final List<String> fields;
    private final boolean unique;

    private IndexSpec(List<String> fields, boolean unique) {
        this.fields = fields;
        this.unique = unique;
    }

    public static IndexSpec unique(String field) {
        return new IndexSpec(List.of(field), true);
    }

    public static IndexSpec on(String... fields) {
        return new IndexSpec(List.of(fields), false);
    }
}
