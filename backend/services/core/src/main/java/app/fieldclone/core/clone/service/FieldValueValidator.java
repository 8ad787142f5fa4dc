package app.fieldclone.core.clone.service;

import app.fieldclone.core.schema.domain.FieldDescriptor;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Type-level checks applied to a transformed value before it is written.
 * Returns the reason for rejection, empty when the value is acceptable.
 */
@Component
public class FieldValueValidator {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");
    private static final Set<String> URL_SCHEMES = Set.of("http", "https", "ftp");

    public Optional<String> validate(JsonNode value, FieldDescriptor descriptor) {
        boolean present = FieldValues.hasValue(value);
        if (descriptor.required() && !present) {
            return Optional.of("value is required");
        }
        if (!present) {
            return Optional.empty();
        }

        return switch (descriptor.type()) {
            case EMAIL -> isEmail(value) ? Optional.empty() : Optional.of("not a valid email address");
            case URL -> isUrl(value) ? Optional.empty() : Optional.of("not a valid URL");
            case NUMBER -> toNumber(value) != null ? Optional.empty() : Optional.of("not a number");
            case RANGE -> checkRange(value, descriptor);
            default -> Optional.empty();
        };
    }

    private boolean isEmail(JsonNode value) {
        return value.isTextual() && EMAIL.matcher(value.asText().trim()).matches();
    }

    private boolean isUrl(JsonNode value) {
        if (!value.isTextual()) {
            return false;
        }
        try {
            URI uri = new URI(value.asText().trim());
            return uri.getScheme() != null
                    && URL_SCHEMES.contains(uri.getScheme().toLowerCase())
                    && uri.getHost() != null;
        } catch (URISyntaxException ex) {
            return false;
        }
    }

    private Optional<String> checkRange(JsonNode value, FieldDescriptor descriptor) {
        Double number = toNumber(value);
        // non-numeric range values are left to the editor
        if (number == null) {
            return Optional.empty();
        }
        if (descriptor.min() != null && number < descriptor.min()) {
            return Optional.of("below minimum " + descriptor.min());
        }
        if (descriptor.max() != null && number > descriptor.max()) {
            return Optional.of("above maximum " + descriptor.max());
        }
        return Optional.empty();
    }

    private Double toNumber(JsonNode value) {
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                // plain decimal or exponent notation only; Java literal suffixes and hex are rejected
                double parsed = new BigDecimal(value.asText().trim()).doubleValue();
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
