package app.fieldclone.core.clone.domain;

import java.util.Map;

public record LayoutInstance(
        int index,
        String layoutName,
        Map<String, AvailableField> fields
) {
}
