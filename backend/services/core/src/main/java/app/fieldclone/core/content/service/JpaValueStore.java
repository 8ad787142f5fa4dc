package app.fieldclone.core.content.service;

import app.fieldclone.core.content.domain.EntityKind;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.entity.ContentEntity;
import app.fieldclone.core.content.repository.ContentEntityRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class JpaValueStore implements ValueStore {

    private final ContentEntityRepository contentEntityRepository;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JpaValueStore(ContentEntityRepository contentEntityRepository,
                         JdbcTemplate jdbcTemplate,
                         ObjectMapper objectMapper) {
        this.contentEntityRepository = contentEntityRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EntityRef> findEntity(long entityId) {
        return contentEntityRepository.findById(entityId).map(JpaValueStore::toEntityRef);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EntityRef> listContent(String schemaId, long excludeEntityId, int limit) {
        return contentEntityRepository.findBySchemaIdAndKindAndStatusInAndEntityIdNotOrderByUpdatedAtDesc(
                        schemaId, EntityKind.CONTENT, SOURCE_STATUSES, excludeEntityId, PageRequest.of(0, limit))
                .stream()
                .map(JpaValueStore::toEntityRef)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public ObjectNode readAll(long entityId) {
        return contentEntityRepository.findById(entityId)
                .map(ContentEntity::getFields)
                .filter(JsonNode::isObject)
                .map(fields -> (ObjectNode) fields)
                .orElseGet(objectMapper::createObjectNode);
    }

    @Override
    @Transactional(readOnly = true)
    public JsonNode read(long entityId, String fieldKey) {
        return contentEntityRepository.findById(entityId)
                .map(ContentEntity::getFields)
                .map(fields -> fields.path(fieldKey))
                .orElse(MissingNode.getInstance());
    }

    @Override
    public void write(long entityId, String fieldKey, JsonNode value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value == null ? NullNode.getInstance() : value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value of field " + fieldKey + " is not serializable", ex);
        }

        // single statement, other keys of the same entity are left untouched
        int updated = jdbcTemplate.update(
                """
                update app_clone.content_entities
                set fields = jsonb_set(coalesce(fields, '{}'::jsonb), array[?]::text[], cast(? as jsonb), true),
                    updated_at = now()
                where entity_id = ?
                """,
                fieldKey,
                json,
                entityId
        );

        if (updated == 0) {
            throw new IllegalStateException("Entity not found: " + entityId);
        }
    }

    static EntityRef toEntityRef(ContentEntity entity) {
        return new EntityRef(
                entity.getEntityId(),
                entity.getSchemaId(),
                entity.getKind(),
                entity.getOwnerId(),
                entity.getTitle(),
                entity.getStatus(),
                entity.getUpdatedAt() != null ? entity.getUpdatedAt() : entity.getCreatedAt()
        );
    }
}
