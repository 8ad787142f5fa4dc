package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.dto.ClonePreviewDTO;
import app.fieldclone.core.clone.domain.dto.FieldPreviewDTO;
import app.fieldclone.core.config.CacheConfig;
import app.fieldclone.core.content.service.EntityAccessService;
import app.fieldclone.core.schema.domain.FieldType;
import app.fieldclone.core.support.InMemoryReferenceResolver;
import app.fieldclone.core.support.InMemorySchemaRegistry;
import app.fieldclone.core.support.InMemoryValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.util.UUID;

import static app.fieldclone.core.support.Fields.field;
import static app.fieldclone.core.support.Fields.group;
import static app.fieldclone.core.support.Fields.json;
import static app.fieldclone.core.support.Fields.repeater;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldPreviewServiceTest {

    static final UUID OWNER = UUID.randomUUID();

    InMemoryValueStore valueStore;
    FieldPreviewService previewService;

    @BeforeEach
    void setUp() {
        valueStore = new InMemoryValueStore();
        valueStore.addEntity(1, "post", OWNER);
        valueStore.addEntity(2, "post", OWNER);
        valueStore.addEntity(3, "page", OWNER);

        InMemorySchemaRegistry registry = new InMemorySchemaRegistry()
                .addGroup("post", "main", "Main",
                        field("intro", FieldType.TEXT),
                        field("featured", FieldType.BOOLEAN),
                        field("colors", FieldType.CHOICE),
                        field("cover", FieldType.ATTACHMENT),
                        repeater("rows", field("caption", FieldType.TEXT)),
                        group("seo", field("title", FieldType.TEXT)))
                .addGroup("post", "notes", "Notes", field("hint", FieldType.MESSAGE));
        InMemoryReferenceResolver resolver = new InMemoryReferenceResolver().attachment(10, "", "cover.png");
        FieldSchemaWalker walker = new FieldSchemaWalker(registry, valueStore, resolver,
                new ConcurrentMapCacheManager(CacheConfig.FIELD_REPORTS_CACHE));
        EntityAccessService accessService = new EntityAccessService(valueStore,
                (actorId, entity) -> entity.ownerId().equals(actorId));
        previewService = new FieldPreviewService(walker, accessService);

        valueStore.put(1, "intro", json("\"<p>One two three four five six seven eight nine ten</p>\""));
        valueStore.put(1, "featured", json("false"));
        valueStore.put(1, "colors", json("[\"red\",\"green\",\"blue\",\"black\"]"));
        valueStore.put(1, "cover", json("10"));
        valueStore.put(1, "rows", json("[{\"caption\":\"a\"},{\"caption\":\"b\"},{\"caption\":\"c\"}]"));
        valueStore.put(1, "hint", json("\"display only\""));
        valueStore.put(2, "featured", json("true"));
    }

    @Test
    void preview_buildsShortDescriptionsAndConflictFlags() {
        ClonePreviewDTO preview = previewService.preview(1, 2, OWNER);

        assertThat(preview.fields()).extracting(g -> g.key()).containsExactly("main");
        var fields = preview.fields().get(0).fields();
        assertThat(fields).extracting(FieldPreviewDTO::key)
                .containsExactly("intro", "featured", "colors", "cover", "rows", "seo");

        assertThat(fields.get(0).preview()).isEqualTo("One two three four five six seven eight...");
        assertThat(fields.get(1).preview()).isEqualTo("No");
        assertThat(fields.get(1).conflictWarning()).isTrue();
        assertThat(fields.get(1).targetHasValue()).isTrue();
        assertThat(fields.get(2).preview()).isEqualTo("red, green, blue...");
        assertThat(fields.get(3).preview()).isEqualTo("cover.png");
        assertThat(fields.get(4).preview()).isEqualTo("3 rows");
        assertThat(fields.get(4).rowCount()).isEqualTo(3);
        assertThat(fields.get(5).preview()).isEqualTo("(empty)");

        assertThat(preview.sourceStats().totalFields()).isEqualTo(7);
        assertThat(preview.targetStats().fieldsWithValues()).isEqualTo(1);
    }

    @Test
    void preview_rejectsForeignTargetAndSchemaMismatch() {
        assertThatThrownBy(() -> previewService.preview(1, 2, UUID.randomUUID()))
                .isInstanceOf(SecurityException.class);
        assertThatThrownBy(() -> previewService.preview(3, 2, OWNER))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> previewService.preview(404, 2, OWNER))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
