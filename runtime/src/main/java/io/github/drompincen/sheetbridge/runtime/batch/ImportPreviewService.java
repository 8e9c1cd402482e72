package io.github.drompincen.sheetbridge.runtime.batch;

import io.github.drompincen.sheetbridge.persistence.document.SchemaDocument;
import io.github.drompincen.sheetbridge.protocol.api.ColumnMatchDto;
import io.github.drompincen.sheetbridge.protocol.api.DataQualityIssue;
import io.github.drompincen.sheetbridge.protocol.api.IssueKind;
import io.github.drompincen.sheetbridge.protocol.api.IssueSeverity;
import io.github.drompincen.sheetbridge.protocol.api.PreviewResponse;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMapper;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMappingPlan;
import io.github.drompincen.sheetbridge.runtime.mapping.ColumnMatch;
import io.github.drompincen.sheetbridge.runtime.mapping.NormalizedRow;
import io.github.drompincen.sheetbridge.runtime.mapping.RowNormalizer;
import io.github.drompincen.sheetbridge.runtime.rows.RowSource;
import io.github.drompincen.sheetbridge.runtime.rows.RowStream;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaCatalogService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Shows how the first rows of a file would be imported, without writing anything. */
@Service
public class ImportPreviewService {

    private final SchemaCatalogService schemaCatalog;
    private final ColumnMapper columnMapper;
    private final RowNormalizer rowNormalizer;
    private final int defaultRows;

    public ImportPreviewService(SchemaCatalogService schemaCatalog, ColumnMapper columnMapper,
                                RowNormalizer rowNormalizer,
                                @Value("${sheetbridge.import.preview-rows:10}") int defaultRows) {
        this.schemaCatalog = schemaCatalog;
        this.columnMapper = columnMapper;
        this.rowNormalizer = rowNormalizer;
        this.defaultRows = defaultRows;
    }

    /**
     * @throws IllegalArgumentException if the schema does not exist
     */
    public PreviewResponse preview(String schemaId, RowSource source, Integer dataStartRow, Integer rows) {
        SchemaDocument schema = schemaCatalog.findDocument(schemaId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown schema: " + schemaId));
        int limit = rows == null || rows <= 0 ? defaultRows : rows;
        int startRow = dataStartRow != null ? dataStartRow : schema.getDataStartRow();

        ColumnMappingPlan plan = columnMapper.match(source.columnLabels(), schema.attributeMap());
        List<ColumnMatchDto> columns = plan.matches().stream().map(ColumnMatch::toDto).toList();
        List<DataQualityIssue> issues = new ArrayList<>();
        List<Map<String, Object>> documents = new ArrayList<>();

        List<ColumnMatch> missingRequired = plan.unmapped().stream().filter(m -> m.attribute().required()).toList();
        if (!missingRequired.isEmpty()) {
            for (ColumnMatch m : missingRequired) {
                issues.add(new DataQualityIssue(0, m.schemaLabel(), m.fieldName(), IssueKind.UNMAPPED_COLUMN,
                        IssueSeverity.FATAL, null, "add a column labelled '" + m.schemaLabel() + "'",
                        "required column is missing; the import would be rejected"));
            }
            return new PreviewResponse(schemaId, columns, plan.unclaimedLabels(), documents, issues);
        }

        try (RowStream stream = source.open(startRow)) {
            boolean first = true;
            while (stream.hasNext() && documents.size() < limit) {
                NormalizedRow row = rowNormalizer.normalize(stream.next(), plan, first);
                first = false;
                issues.addAll(row.issues());
                documents.add(row.fields());
            }
        }
        return new PreviewResponse(schemaId, columns, plan.unclaimedLabels(), documents, issues);
    }
}
