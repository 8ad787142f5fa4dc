package app.fieldclone.core.clone.domain.request;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ValidateSelectionRequest(
        @NotNull Long sourceEntityId,
        List<String> fieldKeys
) {
}
