package app.fieldclone.core.schema.repository;

import app.fieldclone.core.schema.entity.FieldGroupEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FieldGroupRepository extends JpaRepository<FieldGroupEntity, String> {

    List<FieldGroupEntity> findBySchemaIdOrderByOrderIndexAsc(String schemaId);
}
