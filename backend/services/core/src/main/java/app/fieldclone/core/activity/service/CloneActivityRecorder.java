package app.fieldclone.core.activity.service;

import app.fieldclone.core.clone.domain.CloneOutcome;
import app.fieldclone.core.clone.domain.CloneRequest;
import app.fieldclone.core.clone.service.CloneObserver;
import org.springframework.stereotype.Component;

/**
 * Logs every clone run that got past request validation, failed ones included.
 * Rejected requests never reach observers.
 */
@Component
public class CloneActivityRecorder implements CloneObserver {

    private final CloneActivityService activityService;

    public CloneActivityRecorder(CloneActivityService activityService) {
        this.activityService = activityService;
    }

    @Override
    public void onAfterClone(CloneRequest request, CloneOutcome outcome) {
        activityService.record(request, outcome);
    }
}
