package app.fieldclone.core.backup.service;

import app.fieldclone.core.backup.domain.BackupFieldSnapshot;
import app.fieldclone.core.backup.domain.BackupIds;
import app.fieldclone.core.backup.domain.BackupRecord;
import app.fieldclone.core.backup.domain.RestoreResult;
import app.fieldclone.core.backup.entity.FieldBackupEntity;
import app.fieldclone.core.backup.repository.FieldBackupRepository;
import app.fieldclone.core.clone.service.FieldSchemaWalker;
import app.fieldclone.core.clone.service.FieldValues;
import app.fieldclone.core.config.BackupProps;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.service.ValueStore;
import app.fieldclone.core.schema.domain.FieldDescriptor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Snapshots of target values taken before a clone, with restore and retention.
 */
@Service
public class BackupStore {
    private static final Logger log = LoggerFactory.getLogger(BackupStore.class);
    private static final TypeReference<LinkedHashMap<String, BackupFieldSnapshot>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final FieldBackupRepository backupRepository;
    private final ValueStore valueStore;
    private final FieldSchemaWalker schemaWalker;
    private final ObjectMapper objectMapper;
    private final BackupProps props;

    public BackupStore(FieldBackupRepository backupRepository,
                       ValueStore valueStore,
                       FieldSchemaWalker schemaWalker,
                       ObjectMapper objectMapper,
                       BackupProps props) {
        this.backupRepository = backupRepository;
        this.valueStore = valueStore;
        this.schemaWalker = schemaWalker;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    /**
     * Stores the current target values of the given keys. Keys without a value at the target are skipped;
     * when none has a value, nothing is stored.
     *
     * @return the new backup id, or empty when there was nothing to back up
     * @throws IllegalArgumentException when the target entity does not exist
     * @throws IllegalStateException    when the record could not be persisted
     */
    public Optional<String> create(long targetEntityId, List<String> fieldKeys, UUID actorId) {
        EntityRef target = valueStore.findEntity(targetEntityId)
                .orElseThrow(() -> new IllegalArgumentException("Target entity not found: " + targetEntityId));

        Map<String, BackupFieldSnapshot> snapshot = new LinkedHashMap<>();
        for (String fieldKey : fieldKeys) {
            JsonNode current = valueStore.read(targetEntityId, fieldKey);
            if (!FieldValues.hasValue(current)) {
                continue;
            }
            Optional<FieldDescriptor> descriptor = schemaWalker.findDescriptor(target.schemaId(), fieldKey);
            snapshot.put(fieldKey, new BackupFieldSnapshot(
                    current,
                    descriptor.map(FieldDescriptor::label).orElse(fieldKey),
                    descriptor.map(FieldDescriptor::type).orElse(null)
            ));
        }

        if (snapshot.isEmpty()) {
            log.debug("Nothing to back up targetEntityId={} keys={}", targetEntityId, fieldKeys);
            return Optional.empty();
        }

        Instant now = Instant.now();
        String backupId = BackupIds.generate(targetEntityId, now);
        ObjectNode data = objectMapper.valueToTree(snapshot);
        try {
            backupRepository.save(new FieldBackupEntity(backupId, targetEntityId, actorId, snapshot.size(), data, now));
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to persist backup for entity " + targetEntityId, ex);
        }
        log.info("Backup created backupId={} targetEntityId={} fieldCount={}", backupId, targetEntityId, snapshot.size());

        try {
            sweepRetention();
        } catch (RuntimeException ex) {
            log.warn("Backup retention sweep failed after create backupId={} error={}", backupId, ex.getMessage());
        }
        return Optional.of(backupId);
    }

    public RestoreResult restore(String backupId, boolean deleteAfter) {
        if (!BackupIds.isValid(backupId)) {
            return RestoreResult.failed("Invalid backup ID format");
        }
        Optional<FieldBackupEntity> found = backupRepository.findByBackupId(backupId);
        if (found.isEmpty()) {
            return RestoreResult.failed("Backup not found");
        }

        FieldBackupEntity backup = found.get();
        Map<String, BackupFieldSnapshot> snapshot;
        try {
            snapshot = readSnapshot(backup);
        } catch (IllegalArgumentException ex) {
            log.error("Backup data unreadable backupId={} error={}", backupId, ex.getMessage());
            return RestoreResult.failed("Backup data is corrupted");
        }

        long targetEntityId = backup.getTargetEntityId();
        List<String> restored = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, BackupFieldSnapshot> entry : snapshot.entrySet()) {
            String fieldKey = entry.getKey();
            try {
                valueStore.write(targetEntityId, fieldKey, entry.getValue().value());
                restored.add(fieldKey);
            } catch (RuntimeException ex) {
                String label = entry.getValue().label() != null ? entry.getValue().label() : fieldKey;
                log.warn("Restore write failed backupId={} fieldKey={} error={}", backupId, fieldKey, ex.getMessage());
                errors.add("Failed to restore field " + label);
            }
        }
        schemaWalker.invalidate(targetEntityId);

        boolean success = errors.isEmpty();
        if (deleteAfter && success) {
            delete(backupId);
        }

        String message = success
                ? "Restored " + restored.size() + " field(s)"
                : "Restored " + restored.size() + " field(s) with " + errors.size() + " error(s)";
        log.info("Backup restored backupId={} targetEntityId={} restored={} errors={}",
                backupId, targetEntityId, restored.size(), errors.size());
        return new RestoreResult(success, message, restored, errors);
    }

    public boolean delete(String backupId) {
        if (!BackupIds.isValid(backupId)) {
            return false;
        }
        return backupRepository.deleteByBackupId(backupId) > 0;
    }

    public List<BackupRecord> list(long targetEntityId) {
        return backupRepository.findByTargetEntityIdOrderByCreatedAtDescIdDesc(targetEntityId).stream()
                .map(this::toRecord)
                .toList();
    }

    public Optional<BackupRecord> find(String backupId) {
        if (!BackupIds.isValid(backupId)) {
            return Optional.empty();
        }
        return backupRepository.findByBackupId(backupId).map(this::toRecord);
    }

    /**
     * Applies the age rule, then the count rule to what remains.
     *
     * @return number of records deleted
     */
    public int sweepRetention() {
        int deleted = 0;
        if (props.retentionDays() > 0) {
            Instant cutoff = Instant.now().minus(Duration.ofDays(props.retentionDays()));
            deleted += backupRepository.deleteCreatedBefore(cutoff);
        }
        if (props.maxCount() > 0) {
            long excess = backupRepository.count() - props.maxCount();
            if (excess > 0) {
                List<Long> oldest = backupRepository.findOldestIds(PageRequest.of(0, (int) Math.min(excess, Integer.MAX_VALUE)));
                backupRepository.deleteAllByIdInBatch(oldest);
                deleted += oldest.size();
            }
        }
        if (deleted > 0) {
            log.info("Backup retention sweep deleted={}", deleted);
        }
        return deleted;
    }

    private Map<String, BackupFieldSnapshot> readSnapshot(FieldBackupEntity backup) {
        JsonNode data = backup.getBackupData();
        if (data == null || !data.isObject()) {
            throw new IllegalArgumentException("backup_data is not an object");
        }
        return objectMapper.convertValue(data, SNAPSHOT_TYPE);
    }

    private BackupRecord toRecord(FieldBackupEntity entity) {
        Map<String, BackupFieldSnapshot> fields;
        try {
            fields = readSnapshot(entity);
        } catch (IllegalArgumentException ex) {
            log.warn("Backup data unreadable backupId={} error={}", entity.getBackupId(), ex.getMessage());
            fields = Map.of();
        }
        return new BackupRecord(
                entity.getBackupId(),
                entity.getTargetEntityId(),
                entity.getActorId(),
                entity.getFieldCount(),
                fields,
                entity.getCreatedAt()
        );
    }
}
