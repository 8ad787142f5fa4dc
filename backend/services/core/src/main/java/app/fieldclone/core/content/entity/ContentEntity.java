package app.fieldclone.core.content.entity;

import app.fieldclone.core.content.domain.EntityKind;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "content_entities", schema = "app_clone")
public class ContentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(name = "schema_id", nullable = false)
    private String schemaId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false)
    private EntityKind kind;

    @Column(name = "owner_id", nullable = false)
    private UUID ownerId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "file_name")
    private String fileName; // attachments only

    // field key -> value
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "fields", columnDefinition = "jsonb", nullable = false)
    private JsonNode fields;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected ContentEntity() {
    }

    public ContentEntity(String schemaId,
                         EntityKind kind,
                         UUID ownerId,
                         String title,
                         String status,
                         String fileName,
                         JsonNode fields,
                         Instant createdAt,
                         Instant updatedAt) {
        this.schemaId = schemaId;
        this.kind = kind;
        this.ownerId = ownerId;
        this.title = title;
        this.status = status;
        this.fileName = fileName;
        this.fields = fields;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public Long getEntityId() {
        return entityId;
    }

    public String getSchemaId() {
        return schemaId;
    }

    public EntityKind getKind() {
        return kind;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getFileName() {
        return fileName;
    }

    public JsonNode getFields() {
        return fields;
    }

    public void setFields(JsonNode fields) {
        this.fields = fields;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ContentEntity that = (ContentEntity) o;
        return entityId != null && Objects.equals(entityId, that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(entityId);
    }
}
