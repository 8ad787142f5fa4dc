package app.fieldclone.core.content.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "taxonomies", schema = "app_clone")
public class TaxonomyEntity {

    @Id
    @Column(name = "taxonomy", nullable = false)
    private String taxonomy;

    @Column(name = "label", nullable = false)
    private String label;

    protected TaxonomyEntity() {
    }

    public TaxonomyEntity(String taxonomy, String label) {
        this.taxonomy = taxonomy;
        this.label = label;
    }

    public String getTaxonomy() {
        return taxonomy;
    }

    public String getLabel() {
        return label;
    }
}
