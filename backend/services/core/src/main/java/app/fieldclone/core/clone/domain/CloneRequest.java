package app.fieldclone.core.clone.domain;

import java.util.List;
import java.util.UUID;

public record CloneRequest(
        long sourceEntityId,
        long targetEntityId,
        List<String> fieldKeys,
        CloneOptions options,
        UUID actorId
) {
    public CloneRequest {
        fieldKeys = fieldKeys == null ? List.of() : List.copyOf(fieldKeys);
    }
}
