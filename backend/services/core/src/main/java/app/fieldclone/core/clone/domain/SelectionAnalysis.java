package app.fieldclone.core.clone.domain;

import java.util.List;

public record SelectionAnalysis(
        List<String> validFields,
        List<FieldConflict> conflicts,
        List<String> warnings,
        boolean hasConflicts,
        boolean canProceed
) {
    public SelectionAnalysis {
        validFields = List.copyOf(validFields);
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
    }
}
