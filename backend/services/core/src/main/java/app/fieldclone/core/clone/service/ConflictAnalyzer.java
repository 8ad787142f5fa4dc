package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.AvailableField;
import app.fieldclone.core.clone.domain.AvailableFieldsReport;
import app.fieldclone.core.clone.domain.FieldConflict;
import app.fieldclone.core.clone.domain.SelectionAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Classifies a field selection against the source and target reports. Reads only, never writes.
 */
@Component
public class ConflictAnalyzer {

    public SelectionAnalysis analyze(AvailableFieldsReport source,
                                     AvailableFieldsReport target,
                                     List<String> fieldKeys) {
        List<String> valid = new ArrayList<>();
        List<FieldConflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String fieldKey : fieldKeys == null ? List.<String>of() : fieldKeys) {
            Optional<AvailableField> sourceField = source.find(fieldKey);
            if (sourceField.isEmpty()) {
                warnings.add("Field " + fieldKey + " not found in source entity");
                continue;
            }
            AvailableField field = sourceField.get();
            if (!field.isCloneable()) {
                warnings.add("Field " + field.descriptor().label() + " (" + fieldKey + ") is not cloneable");
                continue;
            }

            valid.add(fieldKey);
            target.find(fieldKey)
                    .filter(AvailableField::hasValue)
                    .ifPresent(existing -> conflicts.add(new FieldConflict(
                            fieldKey,
                            field.descriptor().label(),
                            field.descriptor().type()
                    )));
        }

        return new SelectionAnalysis(valid, conflicts, warnings, !conflicts.isEmpty(), !valid.isEmpty());
    }
}
