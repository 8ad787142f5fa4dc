package app.fieldclone.core.activity.domain.dto;

import java.time.Instant;
import java.util.UUID;

public record CloneActivityDTO(
        long activityId,
        long targetEntityId,
        long sourceEntityId,
        String sourceTitle,
        UUID actorId,
        int fieldsCloned,
        boolean success,
        Instant createdAt
) {
}
