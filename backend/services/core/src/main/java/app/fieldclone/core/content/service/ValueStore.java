package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.EntityRef;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Per-field access to entity values. Each write is atomic on its own; there is no multi-field transaction.
 */
public interface ValueStore {

    /**
     * Statuses an entity may have to be offered as a clone source.
     */
    Set<String> SOURCE_STATUSES = Set.of("publish", "draft", "pending");

    Optional<EntityRef> findEntity(long entityId);

    /**
     * Content entities of a schema other than {@code excludeEntityId} whose status is one of
     * {@link #SOURCE_STATUSES}, most recently updated first.
     */
    List<EntityRef> listContent(String schemaId, long excludeEntityId, int limit);

    /**
     * All top-level values of an entity as one object; empty object when the entity does not exist.
     */
    ObjectNode readAll(long entityId);

    /**
     * Current value of a top-level field, or a missing node when the entity or the field does not exist.
     */
    JsonNode read(long entityId, String fieldKey);

    /**
     * @throws IllegalStateException when the entity no longer exists
     */
    void write(long entityId, String fieldKey, JsonNode value);
}
