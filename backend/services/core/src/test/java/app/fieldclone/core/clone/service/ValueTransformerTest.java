package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.CloneOptions;
import app.fieldclone.core.clone.domain.TransformResult;
import app.fieldclone.core.schema.domain.FieldDescriptor;
import app.fieldclone.core.schema.domain.FieldType;
import app.fieldclone.core.support.InMemoryReferenceResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static app.fieldclone.core.support.Fields.field;
import static app.fieldclone.core.support.Fields.flexible;
import static app.fieldclone.core.support.Fields.group;
import static app.fieldclone.core.support.Fields.json;
import static app.fieldclone.core.support.Fields.layout;
import static app.fieldclone.core.support.Fields.repeater;
import static app.fieldclone.core.support.Fields.terms;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTransformerTest {

    private static final CloneOptions COPY_REFS = new CloneOptions(true, true, true, true);
    private static final CloneOptions KEEP_REFS = new CloneOptions(true, true, false, true);

    InMemoryReferenceResolver resolver;
    ValueTransformer transformer;

    @BeforeEach
    void setUp() {
        resolver = new InMemoryReferenceResolver()
                .attachment(10, "Hero", "hero.jpg")
                .attachment(11, "Logo", "logo.png")
                .entity(200)
                .term("category", 7)
                .user(3);
        transformer = new ValueTransformer(resolver);
    }

    @Test
    void transform_scalarValuesPassThrough() {
        TransformResult result = transformer.transform(json("42"), field("price", FieldType.NUMBER), COPY_REFS);

        assertThat(result.value()).isEqualTo(json("42"));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void transform_repeaterKeepsValidReferenceAndWarnsOnceForDeletedOne() {
        FieldDescriptor slides = repeater("slides",
                field("image", FieldType.ATTACHMENT),
                field("caption", FieldType.TEXT));

        TransformResult result = transformer.transform(
                json("[{\"image\":10,\"caption\":\"a\"},{\"image\":999,\"caption\":\"b\"}]"),
                slides,
                COPY_REFS
        );

        assertThat(result.value()).isEqualTo(json("[{\"image\":10,\"caption\":\"a\"},{\"image\":null,\"caption\":\"b\"}]"));
        assertThat(result.warnings()).containsExactly("Attachment ID 999 not found");
    }

    @Test
    void transform_attachmentListDropsMissingEntries() {
        TransformResult result = transformer.transform(json("[10, 999, {\"id\": 11}]"),
                field("gallery", FieldType.ATTACHMENT_LIST), COPY_REFS);

        assertThat(result.value()).isEqualTo(json("[10, {\"id\": 11}]"));
        assertThat(result.warnings()).containsExactly("Attachment ID 999 not found");
    }

    @Test
    void transform_attachmentsUntouchedWhenReferenceCopyDisabled() {
        TransformResult result = transformer.transform(json("[10, 999]"),
                field("gallery", FieldType.ATTACHMENT_LIST), KEEP_REFS);

        assertThat(result.value()).isEqualTo(json("[10, 999]"));
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void transform_repeaterWithNonArrayBecomesEmptyAndSkipsNonObjectRows() {
        FieldDescriptor rows = repeater("rows", field("title", FieldType.TEXT));

        assertThat(transformer.transform(json("\"oops\""), rows, COPY_REFS).value()).isEqualTo(json("[]"));
        assertThat(transformer.transform(json("[1, {\"title\":\"x\",\"extra\":true}]"), rows, COPY_REFS).value())
                .isEqualTo(json("[{\"title\":\"x\",\"extra\":true}]"));
    }

    @Test
    void transform_groupRecursesIntoSubFields() {
        FieldDescriptor contact = group("contact",
                field("email", FieldType.EMAIL),
                field("author", FieldType.USER_REFERENCE));

        TransformResult result = transformer.transform(json("{\"email\":\"a@b.io\",\"author\":99}"), contact, COPY_REFS);

        assertThat(result.value()).isEqualTo(json("{\"email\":\"a@b.io\",\"author\":null}"));
        assertThat(result.warnings()).containsExactly("User ID 99 not found");
        assertThat(transformer.transform(json("[]"), contact, COPY_REFS).value()).isEqualTo(json("{}"));
    }

    @Test
    void transform_flexibleContentPassesUnknownLayoutThroughWithWarning() {
        FieldDescriptor sections = flexible("sections",
                layout("hero", field("image", FieldType.ATTACHMENT)));

        TransformResult result = transformer.transform(
                json("[{\"_layout\":\"hero\",\"image\":999},{\"_layout\":\"quote\",\"text\":\"hi\"},{\"text\":\"no layout\"}]"),
                sections,
                COPY_REFS
        );

        assertThat(result.value()).isEqualTo(json("[{\"_layout\":\"hero\",\"image\":null},{\"_layout\":\"quote\",\"text\":\"hi\"}]"));
        assertThat(result.warnings()).containsExactly(
                "Attachment ID 999 not found",
                "Layout configuration not found for: quote"
        );
    }

    @Test
    void transform_entityReferencesAreRevalidated() {
        TransformResult single = transformer.transform(json("201"), field("related", FieldType.ENTITY_REFERENCE), COPY_REFS);
        TransformResult list = transformer.transform(json("[200, \"201\"]"), field("related", FieldType.ENTITY_REFERENCE_LIST), COPY_REFS);

        assertThat(single.value().isNull()).isTrue();
        assertThat(single.warnings()).containsExactly("Referenced entity ID 201 not found");
        assertThat(list.value()).isEqualTo(json("[200]"));
    }

    @Test
    void transform_termsDroppedWhenTaxonomyMissing() {
        TransformResult result = transformer.transform(json("[7]"), terms("tags", "missing"), COPY_REFS);

        assertThat(result.value()).isEqualTo(json("[]"));
        assertThat(result.warnings()).containsExactly("Taxonomy missing does not exist");
    }

    @Test
    void transform_termsFilteredWithinTaxonomy() {
        TransformResult result = transformer.transform(json("[7, 8]"), terms("tags", "category"), COPY_REFS);

        assertThat(result.value()).isEqualTo(json("[7]"));
        assertThat(result.warnings()).containsExactly("Term ID 8 not found in taxonomy category");
    }

    @Test
    void transform_nonNumericReferenceIsDropped() {
        TransformResult result = transformer.transform(json("[\"abc\"]"), field("gallery", FieldType.ATTACHMENT_LIST), COPY_REFS);

        assertThat(result.value()).isEqualTo(json("[]"));
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void transform_displayOnlyFieldIsRejected() {
        assertThatThrownBy(() -> transformer.transform(json("\"x\""), field("note", FieldType.MESSAGE), COPY_REFS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void transform_doesNotMutateSourceValue() {
        var source = json("[{\"image\":999}]");
        transformer.transform(source, repeater("slides", field("image", FieldType.ATTACHMENT)), COPY_REFS);

        assertThat(source).isEqualTo(json("[{\"image\":999}]"));
    }
}
