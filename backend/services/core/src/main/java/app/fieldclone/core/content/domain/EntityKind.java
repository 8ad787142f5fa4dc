package app.fieldclone.core.content.domain;

public enum EntityKind {
    CONTENT,
    ATTACHMENT
}
