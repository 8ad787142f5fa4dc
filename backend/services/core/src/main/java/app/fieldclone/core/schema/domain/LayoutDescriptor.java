package app.fieldclone.core.schema.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutDescriptor(
        String key,
        String name,
        String label,
        List<FieldDescriptor> subFields
) {
    public LayoutDescriptor {
        label = label == null ? name : label;
        subFields = subFields == null ? List.of() : List.copyOf(subFields);
    }

    public Optional<FieldDescriptor> findSubField(String subFieldName) {
        return FieldDescriptor.findByName(subFields, subFieldName);
    }
}
