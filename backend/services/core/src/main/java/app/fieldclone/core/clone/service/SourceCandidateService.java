package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.FieldStatistics;
import app.fieldclone.core.clone.domain.dto.SourceCandidateDTO;
import app.fieldclone.core.config.CloneProps;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.service.EntityAccessPolicy;
import app.fieldclone.core.content.service.ValueStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class SourceCandidateService {

    private final ValueStore valueStore;
    private final EntityAccessPolicy accessPolicy;
    private final FieldSchemaWalker schemaWalker;
    private final CloneProps props;

    public SourceCandidateService(ValueStore valueStore,
                                  EntityAccessPolicy accessPolicy,
                                  FieldSchemaWalker schemaWalker,
                                  CloneProps props) {
        this.valueStore = valueStore;
        this.accessPolicy = accessPolicy;
        this.schemaWalker = schemaWalker;
        this.props = props;
    }

    public List<SourceCandidateDTO> listCandidates(String schemaId, long excludeEntityId, UUID actorId) {
        if (schemaId == null || schemaId.isBlank()) {
            throw new IllegalArgumentException("schemaId is required");
        }
        int limit = props.maxSourceCandidates();
        List<SourceCandidateDTO> candidates = new ArrayList<>();
        // access is checked after the limited query, so fewer than the limit may come back
        for (EntityRef entity : valueStore.listContent(schemaId, excludeEntityId, limit)) {
            if (!accessPolicy.canEdit(actorId, entity)) {
                continue;
            }
            FieldStatistics stats = schemaWalker.getStatistics(entity.entityId());
            candidates.add(new SourceCandidateDTO(
                    entity.entityId(),
                    entity.title(),
                    entity.status(),
                    entity.updatedAt(),
                    stats.totalFields(),
                    stats
            ));
        }
        return candidates;
    }
}
