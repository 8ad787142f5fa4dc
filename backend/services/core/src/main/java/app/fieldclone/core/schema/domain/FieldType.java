package app.fieldclone.core.schema.domain;

/**
 * Closed set of field kinds a schema may declare.
 * Transform and validation code switches over this enum without a default branch,
 * so adding a constant is a compile error until every dispatch handles it.
 */
public enum FieldType {
    TEXT,
    EMAIL,
    URL,
    NUMBER,
    RANGE,
    CHOICE,
    BOOLEAN,
    ATTACHMENT,
    ATTACHMENT_LIST,
    REPEATER,
    GROUP,
    FLEXIBLE_CONTENT,
    ENTITY_REFERENCE,
    ENTITY_REFERENCE_LIST,
    TERM_REFERENCE,
    USER_REFERENCE,
    // display-only / layout-only markers
    MESSAGE,
    TAB;

    public boolean isCloneable() {
        return this != MESSAGE && this != TAB;
    }

    /**
     * Repeaters and groups are listed in reports even when empty so their structure can be previewed.
     */
    public boolean isAlwaysListed() {
        return this == REPEATER || this == GROUP;
    }
}
