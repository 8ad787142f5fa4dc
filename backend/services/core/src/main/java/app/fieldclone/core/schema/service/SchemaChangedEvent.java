package app.fieldclone.core.schema.service;

public record SchemaChangedEvent(String schemaId, String groupKey) {
}
