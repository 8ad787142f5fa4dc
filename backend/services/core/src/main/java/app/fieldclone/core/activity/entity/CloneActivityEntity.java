package app.fieldclone.core.activity.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "clone_activity", schema = "app_clone")
public class CloneActivityEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "activity_id", nullable = false)
    private Long activityId;

    @Column(name = "target_entity_id", nullable = false)
    private Long targetEntityId;

    @Column(name = "source_entity_id", nullable = false)
    private Long sourceEntityId;

    @Column(name = "source_title")
    private String sourceTitle;

    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "fields_cloned", nullable = false)
    private int fieldsCloned;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected CloneActivityEntity() {
    }

    public CloneActivityEntity(Long targetEntityId,
                               Long sourceEntityId,
                               String sourceTitle,
                               UUID actorId,
                               int fieldsCloned,
                               boolean success,
                               Instant createdAt) {
        this.targetEntityId = targetEntityId;
        this.sourceEntityId = sourceEntityId;
        this.sourceTitle = sourceTitle;
        this.actorId = actorId;
        this.fieldsCloned = fieldsCloned;
        this.success = success;
        this.createdAt = createdAt;
    }

    public Long getActivityId() {
        return activityId;
    }

    public Long getTargetEntityId() {
        return targetEntityId;
    }

    public Long getSourceEntityId() {
        return sourceEntityId;
    }

    public String getSourceTitle() {
        return sourceTitle;
    }

    public UUID getActorId() {
        return actorId;
    }

    public int getFieldsCloned() {
        return fieldsCloned;
    }

    public boolean isSuccess() {
        return success;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CloneActivityEntity that)) return false;
        return activityId != null && Objects.equals(activityId, that.activityId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(activityId);
    }
}
