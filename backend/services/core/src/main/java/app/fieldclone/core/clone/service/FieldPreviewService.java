package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.AvailableField;
import app.fieldclone.core.clone.domain.AvailableFieldsReport;
import app.fieldclone.core.clone.domain.ReportGroup;
import app.fieldclone.core.clone.domain.StructuralStats;
import app.fieldclone.core.clone.domain.dto.ClonePreviewDTO;
import app.fieldclone.core.clone.domain.dto.FieldGroupPreviewDTO;
import app.fieldclone.core.clone.domain.dto.FieldPreviewDTO;
import app.fieldclone.core.content.domain.AttachmentInfo;
import app.fieldclone.core.content.domain.EntityRef;
import app.fieldclone.core.content.service.EntityAccessService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Read-only side-by-side view of a source and target, used before a clone is submitted.
 */
@Service
public class FieldPreviewService {

    private static final int PREVIEW_WORDS = 8;
    private static final int PREVIEW_CHOICES = 3;

    private final FieldSchemaWalker schemaWalker;
    private final EntityAccessService accessService;

    public FieldPreviewService(FieldSchemaWalker schemaWalker, EntityAccessService accessService) {
        this.schemaWalker = schemaWalker;
        this.accessService = accessService;
    }

    /**
     * @throws IllegalArgumentException when either entity is missing or the schemas differ
     * @throws SecurityException        when the actor may not edit the target
     */
    public ClonePreviewDTO preview(long sourceEntityId, long targetEntityId, UUID actorId) {
        EntityRef target = accessService.requireEditable(actorId, targetEntityId);
        AvailableFieldsReport source = schemaWalker.getAvailableFields(sourceEntityId);
        if (source.schemaId() == null) {
            throw new IllegalArgumentException("Entity not found: " + sourceEntityId);
        }
        if (!source.schemaId().equals(target.schemaId())) {
            throw new IllegalArgumentException("Source and target entities must share the same schema");
        }
        AvailableFieldsReport targetReport = schemaWalker.getAvailableFields(targetEntityId);

        List<FieldGroupPreviewDTO> groups = new ArrayList<>();
        for (ReportGroup group : source.groups()) {
            List<FieldPreviewDTO> fields = new ArrayList<>();
            for (AvailableField field : group.fields()) {
                if (!field.isCloneable()) {
                    continue;
                }
                boolean targetHasValue = targetReport.find(field.key())
                        .map(AvailableField::hasValue)
                        .orElse(false);
                fields.add(toPreview(field, targetHasValue));
            }
            if (!fields.isEmpty()) {
                groups.add(new FieldGroupPreviewDTO(group.key(), group.title(), fields));
            }
        }

        return new ClonePreviewDTO(
                sourceEntityId,
                targetEntityId,
                groups,
                schemaWalker.getStatistics(sourceEntityId),
                schemaWalker.getStatistics(targetEntityId)
        );
    }

    private FieldPreviewDTO toPreview(AvailableField field, boolean targetHasValue) {
        StructuralStats stats = field.structuralStats();
        Integer rowCount = null;
        Integer subFieldsCount = null;
        Integer layoutsCount = null;
        AttachmentInfo attachment = null;
        switch (field.descriptor().type()) {
            case REPEATER -> {
                rowCount = stats.rowCount();
                subFieldsCount = stats.subFieldCount();
            }
            case GROUP -> subFieldsCount = stats.subFields().size();
            case FLEXIBLE_CONTENT -> layoutsCount = stats.layoutInstances().size();
            case ATTACHMENT -> attachment = stats.attachment();
            default -> {
            }
        }

        return new FieldPreviewDTO(
                field.key(),
                field.descriptor().name(),
                field.descriptor().label(),
                field.descriptor().type(),
                field.hasValue(),
                targetHasValue,
                field.isCloneable(),
                previewText(field),
                targetHasValue,
                rowCount,
                subFieldsCount,
                layoutsCount,
                attachment
        );
    }

    static String previewText(AvailableField field) {
        if (!field.hasValue()) {
            return "(empty)";
        }
        JsonNode value = field.value();
        StructuralStats stats = field.structuralStats();
        return switch (field.descriptor().type()) {
            case TEXT, EMAIL, URL -> value.isTextual() ? trimWords(value.asText()) : "";
            case NUMBER, RANGE -> value.asText();
            case CHOICE -> choicePreview(value);
            case BOOLEAN -> value.asBoolean() ? "Yes" : "No";
            case ATTACHMENT -> attachmentPreview(stats.attachment());
            case ATTACHMENT_LIST -> plural(value.size(), "attachment");
            case REPEATER -> plural(stats.rowCount(), "row");
            case GROUP -> plural(stats.subFields().size(), "field");
            case FLEXIBLE_CONTENT -> plural(stats.layoutInstances().size(), "layout");
            case ENTITY_REFERENCE, ENTITY_REFERENCE_LIST, TERM_REFERENCE, USER_REFERENCE, MESSAGE, TAB -> "Has value";
        };
    }

    private static String choicePreview(JsonNode value) {
        if (value.isTextual()) {
            return value.asText();
        }
        if (!value.isArray()) {
            return "";
        }
        List<String> shown = new ArrayList<>();
        for (JsonNode option : value) {
            if (shown.size() == PREVIEW_CHOICES) {
                break;
            }
            shown.add(option.asText());
        }
        return String.join(", ", shown) + (value.size() > PREVIEW_CHOICES ? "..." : "");
    }

    private static String attachmentPreview(AttachmentInfo attachment) {
        if (attachment == null) {
            return "Attachment";
        }
        if (attachment.title() != null && !attachment.title().isBlank()) {
            return attachment.title();
        }
        return attachment.fileName() != null ? attachment.fileName() : "Attachment";
    }

    private static String trimWords(String text) {
        String plain = text.replaceAll("<[^>]*>", " ").trim();
        if (plain.isEmpty()) {
            return "";
        }
        String[] words = plain.split("\\s+");
        if (words.length <= PREVIEW_WORDS) {
            return String.join(" ", words);
        }
        return String.join(" ", Arrays.copyOf(words, PREVIEW_WORDS)) + "...";
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
