package app.fieldclone.core.clone.service;

import app.fieldclone.core.clone.domain.AvailableField;
import app.fieldclone.core.clone.domain.AvailableFieldsReport;
import app.fieldclone.core.clone.domain.ReportGroup;
import app.fieldclone.core.clone.domain.SelectionAnalysis;
import app.fieldclone.core.clone.domain.StructuralStats;
import app.fieldclone.core.schema.domain.FieldDescriptor;
import app.fieldclone.core.schema.domain.FieldType;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static app.fieldclone.core.support.Fields.field;
import static app.fieldclone.core.support.Fields.json;
import static org.assertj.core.api.Assertions.assertThat;

class ConflictAnalyzerTest {

    ConflictAnalyzer analyzer = new ConflictAnalyzer();

    @Test
    void analyze_reportsConflictForValuedTargetField() {
        AvailableFieldsReport source = report(1,
                available(field("price", FieldType.NUMBER), true),
                available(field("subtitle", FieldType.TEXT), true));
        AvailableFieldsReport target = report(2,
                available(field("price", FieldType.NUMBER), true));

        SelectionAnalysis analysis = analyzer.analyze(source, target, List.of("price", "subtitle"));

        assertThat(analysis.validFields()).containsExactly("price", "subtitle");
        assertThat(analysis.conflicts()).singleElement()
                .satisfies(c -> {
                    assertThat(c.fieldKey()).isEqualTo("price");
                    assertThat(c.fieldLabel()).isEqualTo("Price");
                    assertThat(c.fieldType()).isEqualTo(FieldType.NUMBER);
                });
        assertThat(analysis.hasConflicts()).isTrue();
        assertThat(analysis.canProceed()).isTrue();
    }

    @Test
    void analyze_warnsOnMissingAndNonCloneableFields() {
        AvailableFieldsReport source = report(1, available(field("note", FieldType.MESSAGE), true));
        AvailableFieldsReport target = report(2);

        SelectionAnalysis analysis = analyzer.analyze(source, target, List.of("note", "ghost"));

        assertThat(analysis.validFields()).isEmpty();
        assertThat(analysis.warnings()).containsExactly(
                "Field Note (note) is not cloneable",
                "Field ghost not found in source entity"
        );
        assertThat(analysis.canProceed()).isFalse();
        assertThat(analysis.hasConflicts()).isFalse();
    }

    @Test
    void analyze_emptyTargetCompositeIsNoConflict() {
        AvailableFieldsReport source = report(1, available(field("rows", FieldType.REPEATER), true));
        AvailableFieldsReport target = report(2, available(field("rows", FieldType.REPEATER), false));

        SelectionAnalysis analysis = analyzer.analyze(source, target, List.of("rows"));

        assertThat(analysis.conflicts()).isEmpty();
    }

    private static AvailableFieldsReport report(long entityId, AvailableField... fields) {
        return new AvailableFieldsReport(entityId, "post", List.of(new ReportGroup("main", "Main", List.of(fields))));
    }

    private static AvailableField available(FieldDescriptor descriptor, boolean hasValue) {
        return new AvailableField("main", descriptor, hasValue ? json("1") : MissingNode.getInstance(),
                hasValue, descriptor.type().isCloneable(), StructuralStats.none());
    }
}
