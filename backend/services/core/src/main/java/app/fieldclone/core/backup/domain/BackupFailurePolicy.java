package app.fieldclone.core.backup.domain;

/**
 * What a clone does when its backup cannot be persisted.
 */
public enum BackupFailurePolicy {
    ABORT,
    PROCEED
}
