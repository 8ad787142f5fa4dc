package app.fieldclone.core.clone.domain.dto;

import java.util.List;

public record FieldGroupPreviewDTO(
        String key,
        String title,
        List<FieldPreviewDTO> fields
) {
}
