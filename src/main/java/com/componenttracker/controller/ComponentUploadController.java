package com.componenttracker.controller;

import com.componenttracker.dto.UploadCommitResponse;
import com.componenttracker.dto.UploadPreviewResponse;
import com.componenttracker.dto.UploadSummaryResponse;
import com.componenttracker.model.BatchResult;
import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.UploadPreview;
import com.componenttracker.service.ComponentIngestionService;
import com.componenttracker.service.UnsupportedPayloadFormatException;
import com.componenttracker.service.UploadHistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/files")
@Tag(name = "Component Upload", description = "Bulk component ingestion from CSV, Excel and JSON files")
public class ComponentUploadController {

    private static final Logger logger = LoggerFactory.getLogger(ComponentUploadController.class);

    static final String ACTOR_HEADER = "X-Actor-Id";
    static final String ANONYMOUS_ACTOR = "anonymous";

    private final ComponentIngestionService componentIngestionService;
    private final UploadHistoryService uploadHistoryService;

    public ComponentUploadController(ComponentIngestionService componentIngestionService,
                                     UploadHistoryService uploadHistoryService) {
        this.componentIngestionService = componentIngestionService;
        this.uploadHistoryService = uploadHistoryService;
    }

    @Operation(
            summary = "Preview an upload",
            description = "Decodes and auto-fixes the first 100 records of a file without saving anything."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Preview produced"),
            @ApiResponse(responseCode = "400", description = "File is empty, unsupported or cannot be parsed"),
            @ApiResponse(responseCode = "413", description = "File exceeds the configured size limit")
    })
    @PostMapping("/upload-preview")
    public ResponseEntity<UploadPreviewResponse> uploadPreview(
            @Parameter(description = "CSV, Excel or JSON file", required = true)
            @RequestParam("file") MultipartFile file) {
        String filename = filenameOf(file);
        PayloadFormat format = resolveFormat(filename);
        logger.info("Received preview request for '{}'", filename);
        UploadPreview preview = componentIngestionService.preview(bytesOf(file), format, filename);
        return ResponseEntity.ok(new UploadPreviewResponse(filename, preview));
    }

    @Operation(
            summary = "Upload and save components",
            description = "Decodes, auto-fixes and reconciles every record of a file. Records whose key already " +
                    "exists are updated, others are created. Row problems are reported, not rejected."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "File processed; see counts and row messages"),
            @ApiResponse(responseCode = "400", description = "File is empty, unsupported or cannot be parsed"),
            @ApiResponse(responseCode = "413", description = "File exceeds the configured size limit")
    })
    @PostMapping("/upload-save")
    public ResponseEntity<UploadCommitResponse> uploadAndSave(
            @Parameter(description = "CSV, Excel or JSON file", required = true)
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "Identifier of the user performing the upload")
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        String filename = filenameOf(file);
        PayloadFormat format = resolveFormat(filename);
        String effectiveActor = actor == null || actor.isBlank() ? ANONYMOUS_ACTOR : actor.trim();
        logger.info("Received upload '{}' from {}", filename, effectiveActor);
        BatchResult result = componentIngestionService.ingest(bytesOf(file), format, filename,
                file.getContentType(), effectiveActor);
        return ResponseEntity.ok(new UploadCommitResponse(filename, result));
    }

    @Operation(summary = "Get an upload summary", description = "Returns the stored summary of one ingestion run.")
    @GetMapping("/uploads/{id}")
    public ResponseEntity<?> getUpload(
            @Parameter(description = "UUID of the upload", required = true)
            @PathVariable UUID id) {
        return uploadHistoryService.find(id)
                .<ResponseEntity<?>>map(upload -> ResponseEntity.ok(new UploadSummaryResponse(upload)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Upload not found for id " + id));
    }

    @Operation(summary = "List uploads by actor", description = "Returns the uploads of one actor, newest first.")
    @GetMapping("/uploads")
    public List<UploadSummaryResponse> listUploads(
            @RequestParam(value = "actor", defaultValue = ANONYMOUS_ACTOR) String actor) {
        return uploadHistoryService.findByActor(actor).stream().map(UploadSummaryResponse::new).toList();
    }

    private static String filenameOf(MultipartFile file) {
        if (file.isEmpty()) {
            throw new EmptyUploadException();
        }
        String original = file.getOriginalFilename();
        String sanitized = original != null ? original.trim().replace("\\", "/") : "";
        int lastSlash = sanitized.lastIndexOf('/');
        if (lastSlash >= 0) {
            sanitized = sanitized.substring(lastSlash + 1);
        }
        return sanitized;
    }

    private static PayloadFormat resolveFormat(String filename) {
        return PayloadFormat.fromFilename(filename)
                .orElseThrow(() -> new UnsupportedPayloadFormatException(filename));
    }

    private static byte[] bytesOf(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading uploaded file", e);
        }
    }

    static class EmptyUploadException extends RuntimeException {
        EmptyUploadException() {
            super("File is empty");
        }
    }
}
