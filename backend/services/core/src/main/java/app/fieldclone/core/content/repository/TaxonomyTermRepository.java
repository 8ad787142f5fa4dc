package app.fieldclone.core.content.repository;

import app.fieldclone.core.content.entity.TaxonomyTermEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TaxonomyTermRepository extends JpaRepository<TaxonomyTermEntity, Long> {

    boolean existsByTermIdAndTaxonomy(Long termId, String taxonomy);
}
