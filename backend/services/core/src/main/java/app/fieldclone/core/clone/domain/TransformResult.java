package app.fieldclone.core.clone.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record TransformResult(
        JsonNode value,
        List<String> warnings
) {
    public TransformResult {
        warnings = List.copyOf(warnings);
    }
}
