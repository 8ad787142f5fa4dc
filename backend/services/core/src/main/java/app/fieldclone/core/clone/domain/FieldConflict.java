package app.fieldclone.core.clone.domain;

import app.fieldclone.core.schema.domain.FieldType;

public record FieldConflict(
        String fieldKey,
        String fieldLabel,
        FieldType fieldType
) {
}
