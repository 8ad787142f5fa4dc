package app.fieldclone.core.activity.service;

import app.fieldclone.core.activity.domain.dto.CloneActivityDTO;
import app.fieldclone.core.activity.entity.CloneActivityEntity;
import app.fieldclone.core.activity.repository.CloneActivityRepository;
import app.fieldclone.core.clone.domain.CloneOutcome;
import app.fieldclone.core.clone.domain.CloneRequest;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.service.EntityAccessService;
import app.fieldclone.core.content.service.ValueStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class CloneActivityService {

    static final int KEEP_PER_TARGET = 10;

    private final CloneActivityRepository activityRepository;
    private final ValueStore valueStore;
    private final EntityAccessService accessService;

    public CloneActivityService(CloneActivityRepository activityRepository,
                                ValueStore valueStore,
                                EntityAccessService accessService) {
        this.activityRepository = activityRepository;
        this.valueStore = valueStore;
        this.accessService = accessService;
    }

    @Transactional
    public void record(CloneRequest request, CloneOutcome outcome) {
        String sourceTitle = valueStore.findEntity(request.sourceEntityId())
                .map(EntityRef::title)
                .orElse(null);
        activityRepository.save(new CloneActivityEntity(
                request.targetEntityId(),
                request.sourceEntityId(),
                sourceTitle,
                request.actorId(),
                outcome.clonedFields().size(),
                outcome.success(),
                Instant.now()
        ));

        List<Long> ids = activityRepository.findIdsNewestFirst(request.targetEntityId());
        if (ids.size() > KEEP_PER_TARGET) {
            activityRepository.deleteAllByIdInBatch(ids.subList(KEEP_PER_TARGET, ids.size()));
        }
    }

    @Transactional(readOnly = true)
    public List<CloneActivityDTO> recent(long targetEntityId, UUID actorId) {
        accessService.requireEditable(actorId, targetEntityId);
        return activityRepository.findByTargetEntityIdOrderByCreatedAtDescActivityIdDesc(targetEntityId).stream()
                .map(a -> new CloneActivityDTO(
                        a.getActivityId(),
                        a.getTargetEntityId(),
                        a.getSourceEntityId(),
                        a.getSourceTitle(),
                        a.getActorId(),
                        a.getFieldsCloned(),
                        a.isSuccess(),
                        a.getCreatedAt()
                ))
                .toList();
    }
}
