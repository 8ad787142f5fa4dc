package app.fieldclone.core.clone.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AvailableFieldsReport {

    private final long entityId;
    private final String schemaId;
    private final List<ReportGroup> groups;
    private final Map<String, AvailableField> byKey;

    public AvailableFieldsReport(long entityId, String schemaId, List<ReportGroup> groups) {
        this.entityId = entityId;
        this.schemaId = schemaId;
        this.groups = List.copyOf(groups);
        Map<String, AvailableField> index = new LinkedHashMap<>();
        for (ReportGroup group : this.groups) {
            for (AvailableField field : group.fields()) {
                index.putIfAbsent(field.key(), field);
            }
        }
        this.byKey = Collections.unmodifiableMap(index);
    }

    public static AvailableFieldsReport empty(long entityId) {
        return new AvailableFieldsReport(entityId, null, List.of());
    }

    public long entityId() {
        return entityId;
    }

    public String schemaId() {
        return schemaId;
    }

    public List<ReportGroup> groups() {
        return groups;
    }

    public Map<String, AvailableField> fields() {
        return byKey;
    }

    public Optional<AvailableField> find(String fieldKey) {
        return Optional.ofNullable(byKey.get(fieldKey));
    }
}
