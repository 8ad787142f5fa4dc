package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.CloneOptions;
import app.fieldclone.core.clone.domain.TransformResult;
import app.fieldclone.core.content.service.ReferenceResolver;
import app.fieldclone.core.schema.domain.FieldDescriptor;
import app.fieldclone.core.schema.domain.LayoutDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.LongFunction;
import java.util.function.LongPredicate;

/**
 * Converts a source value into a value that is safe to write at the target.
 * Reference ids are checked against the current state; nothing is written here.
 */
@Component
public class ValueTransformer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ReferenceResolver referenceResolver;

    public ValueTransformer(ReferenceResolver referenceResolver) {
        this.referenceResolver = referenceResolver;
    }

    public TransformResult transform(JsonNode sourceValue, FieldDescriptor descriptor, CloneOptions options) {
        if (!descriptor.type().isCloneable()) {
            throw new IllegalArgumentException("Field " + descriptor.key() + " of type " + descriptor.type() + " is not cloneable");
        }
        List<String> warnings = new ArrayList<>();
        JsonNode value = process(sourceValue == null ? NullNode.getInstance() : sourceValue, descriptor, options, warnings);
        return new TransformResult(value, warnings);
    }

    private JsonNode process(JsonNode value, FieldDescriptor descriptor, CloneOptions options, List<String> warnings) {
        return switch (descriptor.type()) {
            case TEXT, EMAIL, URL, NUMBER, RANGE, CHOICE, BOOLEAN -> value;
            case ATTACHMENT, ATTACHMENT_LIST -> options.copyReferences()
                    ? references(value, referenceResolver::attachmentExists, id -> "Attachment ID " + id + " not found", warnings)
                    : value;
            case REPEATER -> processRepeater(value, descriptor, options, warnings);
            case GROUP -> processGroup(value, descriptor, options, warnings);
            case FLEXIBLE_CONTENT -> processFlexibleContent(value, descriptor, options, warnings);
            case ENTITY_REFERENCE, ENTITY_REFERENCE_LIST ->
                    references(value, referenceResolver::entityExists, id -> "Referenced entity ID " + id + " not found", warnings);
            case TERM_REFERENCE -> processTerms(value, descriptor, warnings);
            case USER_REFERENCE -> references(value, referenceResolver::userExists, id -> "User ID " + id + " not found", warnings);
            // nested display markers carry no data worth rewriting
            case MESSAGE, TAB -> value;
        };
    }

    private JsonNode processRepeater(JsonNode value, FieldDescriptor descriptor, CloneOptions options, List<String> warnings) {
        ArrayNode rows = NODES.arrayNode();
        if (!value.isArray()) {
            return rows;
        }
        for (JsonNode row : value) {
            if (!row.isObject()) {
                continue;
            }
            rows.add(processProperties((ObjectNode) row, descriptor::findSubField, options, warnings));
        }
        return rows;
    }

    private JsonNode processGroup(JsonNode value, FieldDescriptor descriptor, CloneOptions options, List<String> warnings) {
        if (!value.isObject()) {
            return NODES.objectNode();
        }
        return processProperties((ObjectNode) value, descriptor::findSubField, options, warnings);
    }

    private JsonNode processFlexibleContent(JsonNode value, FieldDescriptor descriptor, CloneOptions options, List<String> warnings) {
        ArrayNode entries = NODES.arrayNode();
        if (!value.isArray()) {
            return entries;
        }
        for (JsonNode entry : value) {
            String layoutName = FieldValues.layoutName(entry);
            if (layoutName == null) {
                continue;
            }

            Optional<LayoutDescriptor> layout = descriptor.findLayout(layoutName);
            if (layout.isEmpty()) {
                warnings.add("Layout configuration not found for: " + layoutName);
                entries.add(entry);
                continue;
            }

            ObjectNode processed = NODES.objectNode();
            processed.put(FieldValues.LAYOUT_PROPERTY, layoutName);
            ObjectNode rest = ((ObjectNode) entry).deepCopy();
            rest.remove(FieldValues.LAYOUT_PROPERTY);
            processed.setAll(processProperties(rest, layout.get()::findSubField, options, warnings));
            entries.add(processed);
        }
        return entries;
    }

    private ObjectNode processProperties(ObjectNode source,
                                         SubFieldLookup lookup,
                                         CloneOptions options,
                                         List<String> warnings) {
        ObjectNode processed = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = source.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> property = it.next();
            Optional<FieldDescriptor> subField = lookup.find(property.getKey());
            // unmatched sub-field names pass through unchanged
            JsonNode subValue = subField.isPresent()
                    ? process(property.getValue(), subField.get(), options, warnings)
                    : property.getValue();
            processed.set(property.getKey(), subValue);
        }
        return processed;
    }

    private JsonNode processTerms(JsonNode value, FieldDescriptor descriptor, List<String> warnings) {
        if (!FieldValues.hasValue(value)) {
            return value;
        }
        String taxonomy = descriptor.taxonomy();
        if (!referenceResolver.taxonomyExists(taxonomy)) {
            warnings.add("Taxonomy " + (taxonomy == null ? "" : taxonomy) + " does not exist");
            return value.isArray() ? NODES.arrayNode() : NullNode.getInstance();
        }
        return references(
                value,
                termId -> referenceResolver.termExists(taxonomy, termId),
                id -> "Term ID " + id + " not found in taxonomy " + taxonomy,
                warnings
        );
    }

    /**
     * Keeps resolvable references. A single unresolved reference becomes null; unresolved list entries are dropped.
     */
    private JsonNode references(JsonNode value, LongPredicate exists, LongFunction<String> notFound, List<String> warnings) {
        if (value.isArray()) {
            ArrayNode kept = NODES.arrayNode();
            for (JsonNode item : value) {
                if (isResolvable(item, exists, notFound, warnings)) {
                    kept.add(item);
                }
            }
            return kept;
        }
        if (!FieldValues.hasValue(value)) {
            return value;
        }
        return isResolvable(value, exists, notFound, warnings) ? value : NullNode.getInstance();
    }

    private boolean isResolvable(JsonNode item, LongPredicate exists, LongFunction<String> notFound, List<String> warnings) {
        OptionalLong id = FieldValues.referenceId(item);
        if (id.isPresent() && exists.test(id.getAsLong())) {
            return true;
        }
        warnings.add(id.isPresent()
                ? notFound.apply(id.getAsLong())
                : "Invalid reference " + FieldValues.describeReference(item) + " dropped");
        return false;
    }

    @FunctionalInterface
    private interface SubFieldLookup {
        Optional<FieldDescriptor> find(String name);
    }
}
