package app.fieldclone.core.clone.domain;

public record FieldStatistics(
        int totalGroups,
        int totalFields,
        int cloneableFields,
        int repeaterFields,
        int groupFields,
        int fieldsWithValues
) {
}
