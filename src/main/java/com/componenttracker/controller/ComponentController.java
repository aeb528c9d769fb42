package com.componenttracker.controller;

import com.componenttracker.dto.ComponentResponse;
import com.componenttracker.repository.ComponentRecordRepository;
import com.componenttracker.service.ComponentExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/components")
@Tag(name = "Components", description = "Stored component lookup and export")
public class ComponentController {

    private final ComponentRecordRepository componentRecordRepository;
    private final ComponentExportService componentExportService;

    public ComponentController(ComponentRecordRepository componentRecordRepository,
                               ComponentExportService componentExportService) {
        this.componentRecordRepository = componentRecordRepository;
        this.componentExportService = componentExportService;
    }

    @Operation(summary = "Export components", description = "Downloads every stored component as CSV.")
    @GetMapping("/export")
    public ResponseEntity<byte[]> export() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"components_export.csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(componentExportService.exportCsv());
    }

    @Operation(summary = "Get component by external key")
    @GetMapping("/{externalKey}")
    public ResponseEntity<?> getByExternalKey(
            @Parameter(description = "Business key of the component", required = true)
            @PathVariable String externalKey) {
        return componentRecordRepository.findByExternalKey(externalKey)
                .<ResponseEntity<?>>map(component -> ResponseEntity.ok(new ComponentResponse(component)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body("Component not found for key " + externalKey));
    }
}
