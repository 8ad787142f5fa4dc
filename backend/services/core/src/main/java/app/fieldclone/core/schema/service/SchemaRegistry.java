package app.fieldclone.core.schema.service;

import app.fieldclone.core.schema.domain.FieldDescriptor;
import app.fieldclone.core.schema.domain.FieldGroup;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the field-group registry. The clone engine never writes through this interface.
 */
public interface SchemaRegistry {

    /**
     * Field groups of a schema in display order. Unknown schema gives an empty list.
     */
    List<FieldGroup> getFieldGroups(String schemaId);

    /**
     * Top-level descriptor by key within a schema.
     */
    default Optional<FieldDescriptor> findField(String schemaId, String fieldKey) {
        if (fieldKey == null) {
            return Optional.empty();
        }
        for (FieldGroup group : getFieldGroups(schemaId)) {
            for (FieldDescriptor field : group.fields()) {
                if (fieldKey.equals(field.key())) {
                    return Optional.of(field);
                }
            }
        }
        return Optional.empty();
    }
}
