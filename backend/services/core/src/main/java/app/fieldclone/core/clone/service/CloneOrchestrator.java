package app.fieldclone.core.clone.service;

import app.fieldclone.core.backup.domain.BackupFailurePolicy;
import app.fieldclone.core.backup.service.BackupStore;
import app.fieldclone.core.clone.domain.CloneOptions;
import app.fieldclone.core.clone.domain.CloneOutcome;
import app.fieldclone.core.clone.domain.CloneRequest;
import app.fieldclone.core.clone.domain.TransformResult;
import app.fieldclone.core.config.BackupProps;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.service.EntityAccessPolicy;
import app.fieldclone.core.content.service.ValueStore;
import app.fieldclone.core.schema.domain.FieldDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs a clone: request checks, optional backup, then per-field transform, validation and write.
 * Each field write is independent; a failed field never undoes the fields written before it.
 */
@Service
public class CloneOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CloneOrchestrator.class);

    static final String BACKUP_ABORT_ERROR = "Backup could not be created; clone aborted";

    private final ValueStore valueStore;
    private final FieldSchemaWalker schemaWalker;
    private final ValueTransformer transformer;
    private final FieldValueValidator validator;
    private final BackupStore backupStore;
    private final EntityAccessPolicy accessPolicy;
    private final BackupProps backupProps;
    private final List<CloneObserver> observers;

    public CloneOrchestrator(ValueStore valueStore,
                             FieldSchemaWalker schemaWalker,
                             ValueTransformer transformer,
                             FieldValueValidator validator,
                             BackupStore backupStore,
                             EntityAccessPolicy accessPolicy,
                             BackupProps backupProps,
                             List<CloneObserver> observers) {
        this.valueStore = valueStore;
        this.schemaWalker = schemaWalker;
        this.transformer = transformer;
        this.validator = validator;
        this.backupStore = backupStore;
        this.accessPolicy = accessPolicy;
        this.backupProps = backupProps;
        this.observers = observers == null ? List.of() : List.copyOf(observers);
    }

    public CloneOutcome cloneFields(CloneRequest request) {
        String rejection = checkRequest(request);
        if (rejection != null) {
            log.warn("Clone rejected sourceEntityId={} targetEntityId={} reason={}",
                    request.sourceEntityId(), request.targetEntityId(), rejection);
            return CloneOutcome.rejected(rejection);
        }

        EntityRef target = valueStore.findEntity(request.targetEntityId()).orElseThrow();
        CloneOptions options = request.options();
        List<String> warnings = new ArrayList<>();

        String backupId = null;
        if (options.createBackup()) {
            try {
                backupId = backupStore.create(target.entityId(), request.fieldKeys(), request.actorId()).orElse(null);
            } catch (RuntimeException ex) {
                if (backupProps.failurePolicy() == BackupFailurePolicy.ABORT) {
                    log.error("Backup failed, clone aborted targetEntityId={} error={}", target.entityId(), ex.getMessage());
                    return CloneOutcome.rejected(BACKUP_ABORT_ERROR);
                }
                log.warn("Backup failed, clone continues targetEntityId={} error={}", target.entityId(), ex.getMessage());
                warnings.add("Backup could not be created: " + ex.getMessage());
            }
        }

        notifyBefore(request);

        List<String> cloned = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        try {
            for (String fieldKey : request.fieldKeys()) {
                FieldResult result = cloneField(request, target, fieldKey, options);
                warnings.addAll(result.warnings());
                if (result.error() == null) {
                    cloned.add(fieldKey);
                } else {
                    errors.add(result.error());
                }
            }
        } finally {
            // earlier fields may already be written
            schemaWalker.invalidate(target.entityId());
        }

        CloneOutcome outcome = CloneOutcome.of(cloned, errors, warnings, backupId);

        if (outcome.success()) {
            log.info("Clone finished sourceEntityId={} targetEntityId={} cloned={} warnings={} backupId={}",
                    request.sourceEntityId(), target.entityId(), cloned.size(), warnings.size(), backupId);
        } else {
            log.warn("Clone finished with errors sourceEntityId={} targetEntityId={} cloned={} errors={} backupId={}",
                    request.sourceEntityId(), target.entityId(), cloned.size(), errors.size(), backupId);
        }
        notifyAfter(request, outcome);
        return outcome;
    }

    private String checkRequest(CloneRequest request) {
        if (request.fieldKeys().isEmpty()) {
            return "No field keys provided for cloning";
        }
        Optional<EntityRef> source = valueStore.findEntity(request.sourceEntityId());
        if (source.isEmpty()) {
            return "Source entity not found";
        }
        Optional<EntityRef> target = valueStore.findEntity(request.targetEntityId());
        if (target.isEmpty()) {
            return "Target entity not found";
        }
        if (!source.get().schemaId().equals(target.get().schemaId())) {
            return "Source and target entities must share the same schema";
        }
        if (!accessPolicy.canEdit(request.actorId(), target.get())) {
            return "You do not have permission to edit the target entity";
        }
        return null;
    }

    private FieldResult cloneField(CloneRequest request, EntityRef target, String fieldKey, CloneOptions options) {
        String label = fieldKey;
        try {
            Optional<FieldDescriptor> found = schemaWalker.findDescriptor(target.schemaId(), fieldKey);
            if (found.isEmpty()) {
                return FieldResult.failed("Field configuration not found for " + fieldKey);
            }
            FieldDescriptor descriptor = found.get();
            label = descriptor.label();
            if (!descriptor.type().isCloneable()) {
                return FieldResult.failed("Field " + label + " is not cloneable");
            }

            JsonNode sourceValue = valueStore.read(request.sourceEntityId(), fieldKey);
            if (!FieldValues.hasValue(sourceValue)) {
                return FieldResult.failed("Field " + fieldKey + " not found in source entity");
            }
            if (!options.overwriteExisting() && FieldValues.hasValue(valueStore.read(target.entityId(), fieldKey))) {
                return FieldResult.failed("Field " + label + " already has a value and overwrite is disabled");
            }

            TransformResult transformed = transformer.transform(sourceValue, descriptor, options);
            if (options.validateData()) {
                Optional<String> invalid = validator.validate(transformed.value(), descriptor);
                if (invalid.isPresent()) {
                    log.debug("Validation failed fieldKey={} reason={}", fieldKey, invalid.get());
                    return new FieldResult("Validation failed for field " + label + ": " + invalid.get(),
                            transformed.warnings());
                }
            }

            try {
                valueStore.write(target.entityId(), fieldKey, transformed.value());
            } catch (RuntimeException ex) {
                log.warn("Field write failed targetEntityId={} fieldKey={} error={}", target.entityId(), fieldKey, ex.getMessage());
                return new FieldResult("Failed to update field " + label, transformed.warnings());
            }
            return new FieldResult(null, transformed.warnings());
        } catch (RuntimeException ex) {
            // lookup or transform failure; the key still gets its own error
            log.warn("Field clone failed targetEntityId={} fieldKey={} error={}", target.entityId(), fieldKey, ex.getMessage());
            return FieldResult.failed("Failed to clone field " + label);
        }
    }

    private void notifyBefore(CloneRequest request) {
        for (CloneObserver observer : observers) {
            try {
                observer.onBeforeClone(request);
            } catch (RuntimeException ex) {
                log.warn("Clone observer failed before clone observer={} error={}",
                        observer.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }

    private void notifyAfter(CloneRequest request, CloneOutcome outcome) {
        for (CloneObserver observer : observers) {
            try {
                observer.onAfterClone(request, outcome);
            } catch (RuntimeException ex) {
                log.warn("Clone observer failed after clone observer={} error={}",
                        observer.getClass().getSimpleName(), ex.getMessage());
            }
        }
    }

    private record FieldResult(String error, List<String> warnings) {
        static FieldResult failed(String error) {
            return new FieldResult(error, List.of());
        }
    }
}
