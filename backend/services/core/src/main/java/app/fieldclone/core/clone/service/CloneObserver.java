package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.CloneOutcome;
import app.fieldclone.core.clone.domain.CloneRequest;

/**
 * Hook around a clone run. Observers cannot change the outcome; their failures are logged and ignored.
 */
public interface CloneObserver {

    default void onBeforeClone(CloneRequest request) {
    }

    void onAfterClone(CloneRequest request, CloneOutcome outcome);
}
