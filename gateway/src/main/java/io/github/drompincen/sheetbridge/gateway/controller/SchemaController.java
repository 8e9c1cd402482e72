package io.github.drompincen.sheetbridge.gateway.controller;

import io.github.drompincen.sheetbridge.protocol.api.CreateSchemaRequest;
import io.github.drompincen.sheetbridge.protocol.api.ProposeSchemaRequest;
import io.github.drompincen.sheetbridge.protocol.api.ResolveSchemaRequest;
import io.github.drompincen.sheetbridge.protocol.api.SchemaDto;
import io.github.drompincen.sheetbridge.runtime.schema.SchemaCatalogService;
import io.github.drompincen.sheetbridge.sources.RowSourceFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/schemas")
public class SchemaController {

    private final SchemaCatalogService schemaCatalog;
    private final RowSourceFactory rowSourceFactory;

    public SchemaController(SchemaCatalogService schemaCatalog, RowSourceFactory rowSourceFactory) {
        this.schemaCatalog = schemaCatalog;
        this.rowSourceFactory = rowSourceFactory;
    }

    @GetMapping
    public List<SchemaDto> list() {
        return schemaCatalog.listByRecency();
    }

    @GetMapping("/{schemaId}")
    public ResponseEntity<SchemaDto> get(@PathVariable String schemaId) {
        return schemaCatalog.findById(schemaId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<SchemaDto> create(@RequestBody CreateSchemaRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(schemaCatalog.create(request));
    }

    /** Returns an unsaved draft; the client edits it and posts it back to create. */
    @PostMapping("/propose")
    public CreateSchemaRequest propose(@RequestBody ProposeSchemaRequest request) {
        List<String> labels = labelsOf(request.columnLabels(), request.filePath(), request.sheetName());
        String name = request.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A schema name is required");
        }
        return schemaCatalog.propose(name, labels);
    }

    @PutMapping("/{schemaId}")
    public ResponseEntity<SchemaDto> update(@PathVariable String schemaId,
                                            @RequestBody CreateSchemaRequest request) {
        return schemaCatalog.update(schemaId, request)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{schemaId}")
    public ResponseEntity<Void> delete(@PathVariable String schemaId) {
        if (schemaCatalog.delete(schemaId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }

    @PostMapping("/resolve")
    public ResponseEntity<SchemaDto> resolve(@RequestBody ResolveSchemaRequest request) {
        return schemaCatalog.resolveForLabels(labelsOf(request.columnLabels(), request.filePath(), request.sheetName()))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // explicit labels win over the file's header row
    private List<String> labelsOf(List<String> columnLabels, String filePath, String sheetName) {
        if (columnLabels != null && !columnLabels.isEmpty()) return columnLabels;
        if (filePath != null && !filePath.isBlank()) {
            return rowSourceFactory.forPath(filePath, sheetName).columnLabels();
        }
        throw new IllegalArgumentException("Either columnLabels or filePath is required");
    }
}
