package app.fieldclone.core.backup.domain;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record BackupRecord(
        String backupId,
        long targetEntityId,
        UUID actorId,
        int fieldCount,
        Map<String, BackupFieldSnapshot> fields,
        Instant createdAt
) {
}
