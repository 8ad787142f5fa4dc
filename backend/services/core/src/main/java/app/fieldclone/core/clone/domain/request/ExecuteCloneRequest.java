package app.fieldclone.core.clone.domain.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ExecuteCloneRequest(
        @NotNull Long sourceEntityId,
        @NotEmpty List<String> fieldKeys,
        CloneOptionsRequest options
) {
}
