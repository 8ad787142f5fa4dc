package app.fieldclone.core.backup.domain;

import java.util.List;

public record RestoreResult(
        boolean success,
        String message,
        List<String> restoredFields,
        List<String> errors
) {
    public RestoreResult {
        restoredFields = List.copyOf(restoredFields);
        errors = List.copyOf(errors);
    }

    public static RestoreResult failed(String error) {
        return new RestoreResult(false, error, List.of(), List.of(error));
    }
}
