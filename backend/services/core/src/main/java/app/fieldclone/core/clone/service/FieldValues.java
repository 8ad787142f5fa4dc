package app.fieldclone.core.clone.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalLong;

/**
 * Value presence and reference id helpers shared by the walker, transformer and validator.
 */
public final class FieldValues {

    public static final String LAYOUT_PROPERTY = "_layout";
    public static final String REFERENCE_ID_PROPERTY = "id";

    private FieldValues() {
    }

    /**
     * A value is present unless it is missing, null, an empty string, an empty array or an empty object.
     * {@code false} and {@code 0} count as values.
     */
    public static boolean hasValue(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isContainerNode()) {
            return !value.isEmpty();
        }
        return true;
    }

    /**
     * Extracts a reference id from a number, a numeric string or an object carrying an {@code id} property.
     */
    public static OptionalLong referenceId(JsonNode value) {
        if (value == null) {
            return OptionalLong.empty();
        }
        if (value.isObject()) {
            return referenceId(value.get(REFERENCE_ID_PROPERTY));
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return OptionalLong.of(value.asLong());
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(Long.parseLong(text));
            } catch (NumberFormatException ex) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Display form of a reference used in warnings: the id when one can be read, the raw text otherwise.
     */
    public static String describeReference(JsonNode value) {
        OptionalLong id = referenceId(value);
        if (id.isPresent()) {
            return Long.toString(id.getAsLong());
        }
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "null";
        }
        if (value.isObject() && value.has(REFERENCE_ID_PROPERTY)) {
            return value.get(REFERENCE_ID_PROPERTY).asText();
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    public static String layoutName(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return null;
        }
        JsonNode layout = entry.get(LAYOUT_PROPERTY);
        return layout != null && layout.isTextual() ? layout.asText() : null;
    }
}
