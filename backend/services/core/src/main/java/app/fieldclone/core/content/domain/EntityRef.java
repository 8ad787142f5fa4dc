package app.fieldclone.core.content.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Identity of an entity as the clone engine sees it. Values are read separately through ValueStore.
 */
public record EntityRef(
        long entityId,
        String schemaId,
        EntityKind kind,
        UUID ownerId,
        String title,
        String status,
        Instant updatedAt
) {
}
