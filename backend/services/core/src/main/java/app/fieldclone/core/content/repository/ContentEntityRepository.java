package app.fieldclone.core.content.repository;

import app.fieldclone.core.content.domain.EntityKind;
import app.fieldclone.core.content.entity.ContentEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ContentEntityRepository extends JpaRepository<ContentEntity, Long> {

    boolean existsByEntityIdAndKind(Long entityId, EntityKind kind);

    List<ContentEntity> findBySchemaIdAndKindAndStatusInAndEntityIdNotOrderByUpdatedAtDesc(
            String schemaId,
            EntityKind kind,
            Collection<String> statuses,
            Long excludedEntityId,
            Pageable pageable
    );
}
