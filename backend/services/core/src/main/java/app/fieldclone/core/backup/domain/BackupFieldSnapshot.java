package app.fieldclone.core.backup.domain;

import app.fieldclone.core.schema.domain.FieldType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stored form of one field inside a backup. Label and type are informational; restore writes {@code value} only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackupFieldSnapshot(
        JsonNode value,
        String label,
        FieldType type
) {
}
