package app.fieldclone.core.clone.domain;

public record CloneOptions(
        boolean overwriteExisting,
        boolean createBackup,
        boolean copyReferences,
        boolean validateData
) {
    /**
     * Request-level overrides on top of configured defaults; null keeps the default.
     */
    public CloneOptions override(Boolean overwriteExisting,
                                 Boolean createBackup,
                                 Boolean copyReferences,
                                 Boolean validateData) {
        return new CloneOptions(
                overwriteExisting != null ? overwriteExisting : this.overwriteExisting,
                createBackup != null ? createBackup : this.createBackup,
                copyReferences != null ? copyReferences : this.copyReferences,
                validateData != null ? validateData : this.validateData
        );
    }
}
