package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.AvailableFieldsReport;
import app.fieldclone.core.clone.domain.CloneOptions;
import app.fieldclone.core.clone.domain.CloneOutcome;
import app.fieldclone.core.clone.domain.CloneRequest;
import app.fieldclone.core.clone.domain.SelectionAnalysis;
import app.fieldclone.core.clone.domain.request.CloneOptionsRequest;
import app.fieldclone.core.clone.domain.request.ExecuteCloneRequest;
import app.fieldclone.core.clone.domain.request.ValidateSelectionRequest;
import app.fieldclone.core.config.CloneProps;
import app.fieldclone.core.content.service.EntityAccessService;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for the HTTP layer: applies configured option defaults and wraps the analyzer.
 */
@Service
public class CloneService {

    private final CloneOrchestrator orchestrator;
    private final ConflictAnalyzer conflictAnalyzer;
    private final FieldSchemaWalker schemaWalker;
    private final EntityAccessService accessService;
    private final CloneProps props;

    public CloneService(CloneOrchestrator orchestrator,
                        ConflictAnalyzer conflictAnalyzer,
                        FieldSchemaWalker schemaWalker,
                        EntityAccessService accessService,
                        CloneProps props) {
        this.orchestrator = orchestrator;
        this.conflictAnalyzer = conflictAnalyzer;
        this.schemaWalker = schemaWalker;
        this.accessService = accessService;
        this.props = props;
    }

    public CloneOutcome execute(UUID actorId, long targetEntityId, ExecuteCloneRequest request) {
        CloneRequest cloneRequest = new CloneRequest(
                request.sourceEntityId(),
                targetEntityId,
                request.fieldKeys(),
                resolveOptions(request.options()),
                actorId
        );
        return orchestrator.cloneFields(cloneRequest);
    }

    /**
     * @throws IllegalArgumentException when the source entity is missing
     * @throws SecurityException        when the actor may not edit the target
     */
    public SelectionAnalysis validate(UUID actorId, long targetEntityId, ValidateSelectionRequest request) {
        accessService.requireEditable(actorId, targetEntityId);
        AvailableFieldsReport source = schemaWalker.getAvailableFields(request.sourceEntityId());
        if (source.schemaId() == null) {
            throw new IllegalArgumentException("Entity not found: " + request.sourceEntityId());
        }
        AvailableFieldsReport target = schemaWalker.getAvailableFields(targetEntityId);
        return conflictAnalyzer.analyze(source, target, request.fieldKeys());
    }

    CloneOptions resolveOptions(CloneOptionsRequest options) {
        CloneOptions defaults = props.defaults().toOptions();
        if (options == null) {
            return defaults;
        }
        return defaults.override(
                options.overwriteExisting(),
                options.createBackup(),
                options.copyReferences(),
                options.validateData()
        );
    }
}
