package app.fieldclone.core.clone.domain;

import java.util.List;

public record ReportGroup(
        String key,
        String title,
        List<AvailableField> fields
) {
    public ReportGroup {
        fields = List.copyOf(fields);
    }
}
