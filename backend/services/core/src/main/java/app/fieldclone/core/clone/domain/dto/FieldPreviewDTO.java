package app.fieldclone.core.clone.domain.dto;

import app.fieldclone.core.content.domain.AttachmentInfo;
import app.fieldclone.core.schema.domain.FieldType;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldPreviewDTO(
        String key,
        String name,
        String label,
        FieldType type,
        boolean hasValue,
        boolean targetHasValue,
        boolean isCloneable,
        String preview,
        boolean conflictWarning,
        Integer rowCount,
        Integer subFieldsCount,
        Integer layoutsCount,
        AttachmentInfo attachmentInfo
) {
}
