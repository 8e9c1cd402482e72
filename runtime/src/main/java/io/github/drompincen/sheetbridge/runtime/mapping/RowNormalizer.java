package io.github.drompincen.sheetbridge.runtime.mapping;

import io.github.drompincen.sheetbridge.protocol.api.AttributeDefinition;
import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.IssueKind;
import io.github.drompincen.sheetbridge.protocol.api.IssueSeverity;
import io.github.drompincen.sheetbridge.protocol.error.DataConversionException;
import io.github.drompincen.sheetbridge.runtime.rows.CellValue;
import io.github.drompincen.sheetbridge.runtime.rows.RawRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link ColumnMappingPlan} to one raw row.
 * <ul>
 *   <li>optional field that fails conversion: ERROR issue, field dropped</li>
 *   <li>required field that fails conversion or is blank: FATAL issue, row errored</li>
 *   <li>blank optional field: omitted</li>
 *   <li>unmapped optional field: WARNING issue, omitted</li>
 * </ul>
 * Fuzzy matches are reported once, as INFO issues on the first data row.
 */
@Component
public class RowNormalizer {

    private final TypeCoercer coercer;

    public RowNormalizer(TypeCoercer coercer) {
        this.coercer = coercer;
    }

    public NormalizedRow normalize(RawRecord record, ColumnMappingPlan plan, boolean firstRow) {
        int row = record.rowNumber();
        Map<String, Object> fields = new LinkedHashMap<>();
        List<DataQualityIssue> issues = new ArrayList<>();

        for (ColumnMatch match : plan.matches()) {
            AttributeDefinition attr = match.attribute();
            if (!match.isMapped()) {
                issues.add(new DataQualityIssue(row, match.schemaLabel(), attr.fieldName(), IssueKind.UNMAPPED_COLUMN,
                        IssueSeverity.WARNING, null, "add a column labelled '" + match.schemaLabel() + "'",
                        "no column for optional field " + attr.fieldName()));
                continue;
            }
            if (firstRow && match.kind() == MatchKind.FUZZY) {
                issues.add(new DataQualityIssue(row, match.fileLabel(), attr.fieldName(), IssueKind.FUZZY_MATCH,
                        IssueSeverity.INFO, null, "rename the column to '" + match.schemaLabel() + "'",
                        String.format("column matched to '%s' by similarity %.2f", match.schemaLabel(), match.score())));
            }

            CellValue cell = record.cell(match.fileLabel());
            if (cell.isBlank()) {
                if (attr.required()) {
                    issues.add(new DataQualityIssue(row, match.fileLabel(), attr.fieldName(), IssueKind.MISSING_REQUIRED_VALUE,
                            IssueSeverity.FATAL, null, "fill in a value", "required value is empty"));
                }
                continue;
            }
            try {
                fields.put(attr.fieldName(), coercer.coerce(cell, attr.type()));
            } catch (DataConversionException e) {
                IssueSeverity severity = attr.required() ? IssueSeverity.FATAL : IssueSeverity.ERROR;
                issues.add(new DataQualityIssue(row, match.fileLabel(), attr.fieldName(), IssueKind.CONVERSION_FAILED,
                        severity, e.getRawValue(), TypeCoercer.suggestion(attr.type()), e.getMessage()));
            }
        }
        return new NormalizedRow(row, fields, issues);
    }
}
