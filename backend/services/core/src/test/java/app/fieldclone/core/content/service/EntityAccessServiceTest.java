package app.fieldclone.core.content.service;

import app.fieldclone.core.support.InMemoryValueStore;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityAccessServiceTest {

    @Test
    void requireEditable_distinguishesMissingFromForbidden() {
        UUID owner = UUID.randomUUID();
        InMemoryValueStore valueStore = new InMemoryValueStore();
        valueStore.addEntity(1, "post", owner);
        EntityAccessService service = new EntityAccessService(valueStore, (actorId, entity) -> entity.ownerId().equals(actorId));

        assertThat(service.requireEditable(owner, 1).entityId()).isEqualTo(1);
        assertThatThrownBy(() -> service.requireEditable(owner, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.requireEditable(UUID.randomUUID(), 1)).isInstanceOf(SecurityException.class);
    }
}
