package app.fieldclone.core.schema.service;

import app.fieldclone.core.schema.domain.FieldDescriptor;
import app.fieldclone.core.schema.domain.FieldGroup;
import app.fieldclone.core.schema.entity.FieldGroupEntity;
import app.fieldclone.core.schema.repository.FieldGroupRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class JpaSchemaRegistry implements SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(JpaSchemaRegistry.class);
    private static final TypeReference<List<FieldDescriptor>> DESCRIPTORS = new TypeReference<>() {
    };

    private final FieldGroupRepository fieldGroupRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;

    public JpaSchemaRegistry(FieldGroupRepository fieldGroupRepository,
                             ObjectMapper objectMapper,
                             ApplicationEventPublisher eventPublisher) {
        this.fieldGroupRepository = fieldGroupRepository;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FieldGroup> getFieldGroups(String schemaId) {
        if (schemaId == null || schemaId.isBlank()) {
            return List.of();
        }
        List<FieldGroup> groups = new ArrayList<>();
        for (FieldGroupEntity entity : fieldGroupRepository.findBySchemaIdOrderByOrderIndexAsc(schemaId)) {
            groups.add(toFieldGroup(entity));
        }
        return groups;
    }

    @Transactional
    public FieldGroup saveGroup(FieldGroup group) {
        if (group.key() == null || group.key().isBlank()) {
            throw new IllegalArgumentException("Group key is required");
        }
        JsonNode fields = objectMapper.valueToTree(group.fields());
        FieldGroupEntity entity = fieldGroupRepository.findById(group.key())
                .map(existing -> {
                    if (!existing.getSchemaId().equals(group.schemaId())) {
                        throw new IllegalArgumentException("Group " + group.key() + " belongs to schema " + existing.getSchemaId());
                    }
                    existing.setTitle(group.title());
                    existing.setOrderIndex(group.orderIndex());
                    existing.setFields(fields);
                    existing.setUpdatedAt(Instant.now());
                    return existing;
                })
                .orElseGet(() -> new FieldGroupEntity(
                        group.key(),
                        group.schemaId(),
                        group.title(),
                        group.orderIndex(),
                        fields,
                        Instant.now()
                ));

        FieldGroup saved = toFieldGroup(fieldGroupRepository.save(entity));
        eventPublisher.publishEvent(new SchemaChangedEvent(saved.schemaId(), saved.key()));
        return saved;
    }

    @Transactional
    public void deleteGroup(String groupKey) {
        fieldGroupRepository.findById(groupKey).ifPresent(entity -> {
            fieldGroupRepository.delete(entity);
            eventPublisher.publishEvent(new SchemaChangedEvent(entity.getSchemaId(), groupKey));
        });
    }

    private FieldGroup toFieldGroup(FieldGroupEntity entity) {
        List<FieldDescriptor> fields;
        try {
            fields = entity.getFields() == null || entity.getFields().isNull()
                    ? List.of()
                    : objectMapper.convertValue(entity.getFields(), DESCRIPTORS);
        } catch (IllegalArgumentException ex) {
            log.warn("Unreadable field group configuration: groupKey={}, error={}", entity.getGroupKey(), ex.getMessage());
            fields = List.of();
        }
        return new FieldGroup(
                entity.getGroupKey(),
                entity.getTitle(),
                entity.getSchemaId(),
                entity.getOrderIndex() == null ? 0 : entity.getOrderIndex(),
                fields
        );
    }
}
