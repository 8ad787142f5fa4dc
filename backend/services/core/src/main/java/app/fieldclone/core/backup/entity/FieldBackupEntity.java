package app.fieldclone.core.backup.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "field_backups", schema = "app_clone")
public class FieldBackupEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "backup_id", nullable = false, unique = true, length = 100)
    private String backupId;

    @Column(name = "target_entity_id", nullable = false)
    private Long targetEntityId;

    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "field_count", nullable = false)
    private int fieldCount;

    // field key -> {value, label, type}
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "backup_data", columnDefinition = "jsonb", nullable = false)
    private JsonNode backupData;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected FieldBackupEntity() {
    }

    public FieldBackupEntity(String backupId,
                             Long targetEntityId,
                             UUID actorId,
                             int fieldCount,
                             JsonNode backupData,
                             Instant createdAt) {
        this.backupId = backupId;
        this.targetEntityId = targetEntityId;
        this.actorId = actorId;
        this.fieldCount = fieldCount;
        this.backupData = backupData;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getBackupId() {
        return backupId;
    }

    public Long getTargetEntityId() {
        return targetEntityId;
    }

    public UUID getActorId() {
        return actorId;
    }

    public int getFieldCount() {
        return fieldCount;
    }

    public JsonNode getBackupData() {
        return backupData;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldBackupEntity that)) return false;
        return Objects.equals(backupId, that.backupId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(backupId);
    }
}
