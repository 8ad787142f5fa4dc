package app.fieldclone.core.clone.domain;

import java.util.List;

public record CloneOutcome(
        boolean success,
        String message,
        List<String> clonedFields,
        List<String> errors,
        List<String> warnings,
        String backupId
) {
    public CloneOutcome {
        clonedFields = List.copyOf(clonedFields);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static CloneOutcome rejected(String error) {
        return new CloneOutcome(false, error, List.of(), List.of(error), List.of(), null);
    }

    public static CloneOutcome of(List<String> clonedFields, List<String> errors, List<String> warnings, String backupId) {
        return new CloneOutcome(errors.isEmpty(), summarize(clonedFields.size(), errors.size(), warnings.size()),
                clonedFields, errors, warnings, backupId);
    }

    static String summarize(int cloned, int errors, int warnings) {
        StringBuilder message = new StringBuilder();
        if (errors == 0) {
            message.append("Successfully cloned ").append(cloned).append(" field(s)");
            if (warnings > 0) {
                message.append(" with ").append(warnings).append(" warning(s)");
            }
        } else {
            message.append("Cloned ").append(cloned).append(" field(s) with ").append(errors).append(" error(s)");
            if (warnings > 0) {
                message.append(" and ").append(warnings).append(" warning(s)");
            }
        }
        return message.toString();
    }
}
