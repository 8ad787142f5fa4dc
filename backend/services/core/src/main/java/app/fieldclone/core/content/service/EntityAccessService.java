package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.EntityRef;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entity lookup plus edit check for endpoints outside the clone outcome.
 */
@Service
public class EntityAccessService {

    private final ValueStore valueStore;
    private final EntityAccessPolicy accessPolicy;

    public EntityAccessService(ValueStore valueStore, EntityAccessPolicy accessPolicy) {
        this.valueStore = valueStore;
        this.accessPolicy = accessPolicy;
    }

    /**
     * @throws IllegalArgumentException when the entity does not exist
     * @throws SecurityException        when the actor may not edit it
     */
    public EntityRef requireEditable(UUID actorId, long entityId) {
        EntityRef entity = valueStore.findEntity(entityId)
                .orElseThrow(() -> new IllegalArgumentException("Entity not found: " + entityId));
        if (!accessPolicy.canEdit(actorId, entity)) {
            throw new SecurityException("Access denied to entity " + entityId);
        }
        return entity;
    }
}
