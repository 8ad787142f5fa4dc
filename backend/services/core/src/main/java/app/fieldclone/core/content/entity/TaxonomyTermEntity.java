package app.fieldclone.core.content.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "taxonomy_terms", schema = "app_clone")
public class TaxonomyTermEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "term_id", nullable = false)
    private Long termId;

    @Column(name = "taxonomy", nullable = false)
    private String taxonomy;

    @Column(name = "name", nullable = false)
    private String name;

    protected TaxonomyTermEntity() {
    }

    public TaxonomyTermEntity(String taxonomy, String name) {
        this.taxonomy = taxonomy;
        this.name = name;
    }

    public Long getTermId() {
        return termId;
    }

    public String getTaxonomy() {
        return taxonomy;
    }

    public String getName() {
        return name;
    }
}
