package app.fieldclone.core.clone.domain.dto;

import app.fieldclone.core.clone.domain.FieldStatistics;

import java.util.List;

public record ClonePreviewDTO(
        long sourceEntityId,
        long targetEntityId,
        List<FieldGroupPreviewDTO> fields,
        FieldStatistics sourceStats,
        FieldStatistics targetStats
) {
}
