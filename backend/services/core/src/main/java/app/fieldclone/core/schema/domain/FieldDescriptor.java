package app.fieldclone.core.schema.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldDescriptor(
        String key,
        String name,
        String label,
        FieldType type,
        boolean required,
        String taxonomy, // only TERM_REFERENCE
        Double min,      // only RANGE
        Double max,
        List<FieldDescriptor> subFields,
        List<LayoutDescriptor> layouts
) {
    public FieldDescriptor {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Field key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Field type is required for " + key);
        }
        name = name == null ? key : name;
        label = label == null ? name : label;
        subFields = subFields == null ? List.of() : List.copyOf(subFields);
        layouts = layouts == null ? List.of() : List.copyOf(layouts);
    }

    public static FieldDescriptor scalar(String key, String name, String label, FieldType type) {
        return new FieldDescriptor(key, name, label, type, false, null, null, null, null, null);
    }

    public FieldDescriptor withRequired(boolean required) {
        return new FieldDescriptor(key, name, label, type, required, taxonomy, min, max, subFields, layouts);
    }

    public Optional<FieldDescriptor> findSubField(String subFieldName) {
        return findByName(subFields, subFieldName);
    }

    public Optional<LayoutDescriptor> findLayout(String layoutName) {
        if (layoutName == null) {
            return Optional.empty();
        }
        return layouts.stream()
                .filter(layout -> layoutName.equals(layout.name()))
                .findFirst();
    }

    static Optional<FieldDescriptor> findByName(List<FieldDescriptor> fields, String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return fields.stream()
                .filter(field -> fieldName.equals(field.name()))
                .findFirst();
    }
}
