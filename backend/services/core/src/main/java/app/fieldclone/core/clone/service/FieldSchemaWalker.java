package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.AvailableField;
import app.fieldclone.core.clone.domain.AvailableFieldsReport;
import app.fieldclone.core.clone.domain.FieldStatistics;
import app.fieldclone.core.clone.domain.LayoutInstance;
import app.fieldclone.core.clone.domain.ReportGroup;
import app.fieldclone.core.clone.domain.StructuralStats;
import app.fieldclone.core.config.CacheConfig;
import app.fieldclone.core.content.domain.AttachmentInfo;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.service.ReferenceResolver;
import app.fieldclone.core.content.service.ValueStore;
import app.fieldclone.core.schema.domain.FieldDescriptor;
import app.fieldclone.core.schema.domain.FieldGroup;
import app.fieldclone.core.schema.domain.LayoutDescriptor;
import app.fieldclone.core.schema.service.SchemaChangedEvent;
import app.fieldclone.core.schema.service.SchemaRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Builds the per-entity report of fields that carry values, grouped as the schema declares them.
 * Reports are cached per entity and dropped on any write to that entity or any schema change.
 */
@Service
public class FieldSchemaWalker {
    private static final Logger log = LoggerFactory.getLogger(FieldSchemaWalker.class);
    private static final String CACHE_NAME = CacheConfig.FIELD_REPORTS_CACHE;

    private final SchemaRegistry schemaRegistry;
    private final ValueStore valueStore;
    private final ReferenceResolver referenceResolver;
    private final CacheManager cacheManager;

    public FieldSchemaWalker(SchemaRegistry schemaRegistry,
                             ValueStore valueStore,
                             ReferenceResolver referenceResolver,
                             CacheManager cacheManager) {
        this.schemaRegistry = schemaRegistry;
        this.valueStore = valueStore;
        this.referenceResolver = referenceResolver;
        this.cacheManager = cacheManager;
    }

    public AvailableFieldsReport getAvailableFields(long entityId) {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        AvailableFieldsReport cached = safeGet(cache, entityId);
        if (cached != null) {
            return cached;
        }

        Optional<EntityRef> entity = valueStore.findEntity(entityId);
        if (entity.isEmpty()) {
            return AvailableFieldsReport.empty(entityId);
        }

        String schemaId = entity.get().schemaId();
        ObjectNode values = valueStore.readAll(entityId);
        List<ReportGroup> groups = new ArrayList<>();
        for (FieldGroup group : schemaRegistry.getFieldGroups(schemaId)) {
            List<AvailableField> fields = new ArrayList<>();
            for (FieldDescriptor descriptor : group.fields()) {
                AvailableField field = resolveField(group.key(), descriptor, values.path(descriptor.key()));
                if (field.hasValue() || descriptor.type().isAlwaysListed()) {
                    fields.add(field);
                }
            }
            if (!fields.isEmpty()) {
                groups.add(new ReportGroup(group.key(), group.title(), fields));
            }
        }

        AvailableFieldsReport report = new AvailableFieldsReport(entityId, schemaId, groups);
        safePut(cache, entityId, report);
        return report;
    }

    public FieldStatistics getStatistics(long entityId) {
        AvailableFieldsReport report = getAvailableFields(entityId);
        int totalFields = 0;
        int cloneable = 0;
        int repeaters = 0;
        int groups = 0;
        int withValues = 0;
        for (ReportGroup group : report.groups()) {
            for (AvailableField field : group.fields()) {
                totalFields++;
                if (field.isCloneable()) {
                    cloneable++;
                }
                if (field.hasValue()) {
                    withValues++;
                }
                switch (field.descriptor().type()) {
                    case REPEATER -> repeaters++;
                    case GROUP -> groups++;
                    default -> {
                    }
                }
            }
        }
        return new FieldStatistics(report.groups().size(), totalFields, cloneable, repeaters, groups, withValues);
    }

    /**
     * Schema lookup for a top-level field, regardless of whether the entity holds a value for it.
     */
    public Optional<FieldDescriptor> findDescriptor(String schemaId, String fieldKey) {
        return schemaRegistry.findField(schemaId, fieldKey);
    }

    public void invalidate(long entityId) {
        safeEvict(cacheManager.getCache(CACHE_NAME), entityId);
    }

    public void invalidateAll() {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            return;
        }
        try {
            cache.clear();
        } catch (RuntimeException ex) {
            log.warn("Cache clear failed for {}: {}", CACHE_NAME, ex.getMessage());
        }
    }

    @EventListener
    public void onSchemaChanged(SchemaChangedEvent event) {
        log.debug("Schema changed, dropping field reports schemaId={} groupKey={}", event.schemaId(), event.groupKey());
        invalidateAll();
    }

    private AvailableField resolveField(String groupKey, FieldDescriptor descriptor, JsonNode value) {
        JsonNode actual = value == null ? MissingNode.getInstance() : value;
        boolean hasValue = FieldValues.hasValue(actual);
        StructuralStats stats = switch (descriptor.type()) {
            case REPEATER -> repeaterStats(groupKey, descriptor, actual);
            case GROUP -> groupStats(groupKey, descriptor, actual);
            case FLEXIBLE_CONTENT -> flexibleContentStats(groupKey, descriptor, actual);
            case ATTACHMENT -> attachmentStats(actual);
            default -> StructuralStats.none();
        };
        return new AvailableField(groupKey, descriptor, actual, hasValue, descriptor.type().isCloneable(), stats);
    }

    private StructuralStats repeaterStats(String groupKey, FieldDescriptor descriptor, JsonNode value) {
        List<Map<String, AvailableField>> rows = new ArrayList<>();
        if (value.isArray()) {
            for (JsonNode row : value) {
                Map<String, AvailableField> resolved = new LinkedHashMap<>();
                for (FieldDescriptor subField : descriptor.subFields()) {
                    resolved.put(subField.name(), resolveField(groupKey, subField, row.path(subField.name())));
                }
                rows.add(resolved);
            }
        }
        return new StructuralStats(rows.size(), descriptor.subFields().size(), 0,
                rows, null, null, null, null);
    }

    private StructuralStats groupStats(String groupKey, FieldDescriptor descriptor, JsonNode value) {
        Map<String, AvailableField> subFields = new LinkedHashMap<>();
        for (FieldDescriptor subField : descriptor.subFields()) {
            AvailableField resolved = resolveField(groupKey, subField, value.path(subField.name()));
            if (resolved.hasValue() || subField.type().isAlwaysListed()) {
                subFields.put(subField.name(), resolved);
            }
        }
        return new StructuralStats(0, descriptor.subFields().size(), 0,
                null, subFields, null, null, null);
    }

    private StructuralStats flexibleContentStats(String groupKey, FieldDescriptor descriptor, JsonNode value) {
        List<LayoutInstance> instances = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (value.isArray()) {
            for (int index = 0; index < value.size(); index++) {
                JsonNode entry = value.get(index);
                String layoutName = FieldValues.layoutName(entry);
                // entries without a layout are dropped on clone as well
                if (layoutName == null) {
                    continue;
                }
                Optional<LayoutDescriptor> layout = descriptor.findLayout(layoutName);
                if (layout.isEmpty()) {
                    warnings.add("Layout configuration not found for: " + layoutName);
                    continue;
                }
                Map<String, AvailableField> fields = new LinkedHashMap<>();
                for (FieldDescriptor subField : layout.get().subFields()) {
                    fields.put(subField.name(), resolveField(groupKey, subField, entry.path(subField.name())));
                }
                instances.add(new LayoutInstance(index, layoutName, fields));
            }
        }
        return new StructuralStats(0, 0, descriptor.layouts().size(),
                null, null, instances, null, warnings);
    }

    private StructuralStats attachmentStats(JsonNode value) {
        OptionalLong id = FieldValues.referenceId(value);
        if (id.isEmpty()) {
            return StructuralStats.none();
        }
        AttachmentInfo attachment = referenceResolver.findAttachment(id.getAsLong()).orElse(null);
        return new StructuralStats(0, 0, 0, null, null, null, attachment, null);
    }

    private AvailableFieldsReport safeGet(Cache cache, long entityId) {
        if (cache == null) {
            return null;
        }
        try {
            return cache.get(entityId, AvailableFieldsReport.class);
        } catch (RuntimeException ex) {
            log.warn("Cache get failed for {}: {}", CACHE_NAME, ex.getMessage());
            return null;
        }
    }

    private void safePut(Cache cache, long entityId, AvailableFieldsReport report) {
        if (cache == null) {
            return;
        }
        try {
            cache.put(entityId, report);
        } catch (RuntimeException ex) {
            log.warn("Cache put failed for {}: {}", CACHE_NAME, ex.getMessage());
        }
    }

    private void safeEvict(Cache cache, long entityId) {
        if (cache == null) {
            return;
        }
        try {
            cache.evict(entityId);
        } catch (RuntimeException ex) {
            log.warn("Cache evict failed for {}: {}", CACHE_NAME, ex.getMessage());
        }
    }
}
