package app.fieldclone.core.content.repository;

import app.fieldclone.core.content.entity.TaxonomyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TaxonomyRepository extends JpaRepository<TaxonomyEntity, String> {
}
