package app.fieldclone.core.schema.domain;

import java.util.List;

public record FieldGroup(
        String key,
        String title,
        String schemaId,
        int orderIndex,
        List<FieldDescriptor> fields
) {
    public FieldGroup {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }
}
