package app.fieldclone.core.clone.domain.dto;

import app.fieldclone.core.clone.domain.FieldStatistics;

import java.time.Instant;

public record SourceCandidateDTO(
        long entityId,
        String title,
        String status,
        Instant updatedAt,
        int fieldCount,
        FieldStatistics stats
) {
}
