package app.fieldclone.core.clone.domain;

import app.fieldclone.core.content.domain.AttachmentInfo;

import java.util.List;
import java.util.Map;

/**
 * Shape of a composite value, used for previews. Only the parts relevant to the field type are filled.
 *
 * @param rows             repeater rows, each sub-field name to its resolved sub-field
 * @param subFields        group sub-fields resolved once
 * @param layoutInstances  flexible content entries matched to a layout
 * @param warnings         unmatched layouts and similar non-fatal findings
 */
public record StructuralStats(
        int rowCount,
        int subFieldCount,
        int layoutCount,
        List<Map<String, AvailableField>> rows,
        Map<String, AvailableField> subFields,
        List<LayoutInstance> layoutInstances,
        AttachmentInfo attachment,
        List<String> warnings
) {
    public StructuralStats {
        rows = rows == null ? List.of() : List.copyOf(rows);
        subFields = subFields == null ? Map.of() : subFields;
        layoutInstances = layoutInstances == null ? List.of() : List.copyOf(layoutInstances);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static StructuralStats none() {
        return new StructuralStats(0, 0, 0, null, null, null, null, null);
    }
}
