package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.EntityRef;

import java.util.UUID;

public interface EntityAccessPolicy {

    boolean canEdit(UUID actorId, EntityRef entity);
}
