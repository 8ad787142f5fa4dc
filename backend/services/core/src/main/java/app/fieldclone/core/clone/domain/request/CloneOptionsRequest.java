package app.fieldclone.core.clone.domain.request;

public record CloneOptionsRequest(
        Boolean overwriteExisting,
        Boolean createBackup,
        Boolean copyReferences,
        Boolean validateData
) {
}
