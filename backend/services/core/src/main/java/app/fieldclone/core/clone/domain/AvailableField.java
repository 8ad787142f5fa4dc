package app.fieldclone.core.clone.domain;

import app.fieldclone.core.schema.domain.FieldDescriptor;
import com.fasterxml.jackson.databind.JsonNode;

public record AvailableField(
        String groupKey,
        FieldDescriptor descriptor,
        JsonNode value,
        boolean hasValue,
        boolean isCloneable,
        StructuralStats structuralStats
) {
    public String key() {
        return descriptor.key();
    }
}
