package app.fieldclone.core.schema.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "field_groups", schema = "app_clone")
public class FieldGroupEntity {

    @Id
    @Column(name = "group_key", nullable = false)
    private String groupKey;

    @Column(name = "schema_id", nullable = false)
    private String schemaId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "order_index", nullable = false)
    private Integer orderIndex;

    // descriptor tree, see FieldDescriptor
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "fields", columnDefinition = "jsonb", nullable = false)
    private JsonNode fields;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected FieldGroupEntity() {
    }

    public FieldGroupEntity(String groupKey,
                            String schemaId,
                            String title,
                            Integer orderIndex,
                            JsonNode fields,
                            Instant updatedAt) {
        this.groupKey = groupKey;
        this.schemaId = schemaId;
        this.title = title;
        this.orderIndex = orderIndex;
        this.fields = fields;
        this.updatedAt = updatedAt;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public String getSchemaId() {
        return schemaId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Integer getOrderIndex() {
        return orderIndex;
    }

    public void setOrderIndex(Integer orderIndex) {
        this.orderIndex = orderIndex;
    }

    public JsonNode getFields() {
        return fields;
    }

    public void setFields(JsonNode fields) {
        this.fields = fields;
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
        FieldGroupEntity that = (FieldGroupEntity) o;
        return Objects.equals(groupKey, that.groupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(groupKey);
    }
}
