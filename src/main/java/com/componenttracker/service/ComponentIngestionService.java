package com.componenttracker.service;

import com.componenttracker.dto.ComponentUpdateEvent;
import com.componenttracker.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Drives one upload through decode, validation and reconciliation.
 *
 * Only a payload that cannot be decoded at all ends in an exception; every later problem is
 * auto-fixed or isolated to its row and reported inside the returned {@link BatchResult}.
 * Not transactional; the reconciler owns the chunk transactions.
 */
@Service
public class ComponentIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(ComponentIngestionService.class);

    private final List<PayloadDecoder> decoders;
    private final RecordValidator recordValidator;
    private final BatchReconciler batchReconciler;
    private final UploadProgressService uploadProgressService;
    private final UploadHistoryService uploadHistoryService;
    private final long maxPayloadBytes;
    private final int previewLimit;

    public ComponentIngestionService(List<PayloadDecoder> decoders,
                                     RecordValidator recordValidator,
                                     BatchReconciler batchReconciler,
                                     UploadProgressService uploadProgressService,
                                     UploadHistoryService uploadHistoryService,
                                     @Value("${app.ingestion.max-payload-bytes:10485760}") long maxPayloadBytes,
                                     @Value("${app.ingestion.preview-limit:100}") int previewLimit) {
        this.decoders = decoders;
        this.recordValidator = recordValidator;
        this.batchReconciler = batchReconciler;
        this.uploadProgressService = uploadProgressService;
        this.uploadHistoryService = uploadHistoryService;
        this.maxPayloadBytes = maxPayloadBytes;
        this.previewLimit = previewLimit;
    }

    /**
     * Ingests an upload and commits its components.
     *
     * @throws PayloadTooLargeException when the payload exceeds the configured limit; nothing is recorded
     * @throws FatalDecodeException when the payload cannot be parsed; no component is written
     */
    public BatchResult ingest(byte[] payload, PayloadFormat format, String filename, String contentType, String actor) {
        checkSize(payload);
        logger.info("Starting ingestion of '{}' ({} bytes, {}) for actor {}", filename, payload.length, format, actor);
        UUID uploadId = uploadHistoryService.start(filename, contentType, format, payload.length, actor);
        uploadProgressService.started(filename);

        List<RawRecord> rawRecords;
        try {
            rawRecords = decode(uploadId, payload, format);
        } catch (FatalDecodeException e) {
            stage(uploadId, IngestionStage.FAILED);
            logger.error("Ingestion of '{}' aborted, payload could not be decoded: {}", filename, e.getMessage());
            uploadHistoryService.decodeFailed(uploadId, e.getMessage());
            uploadProgressService.failed(filename);
            throw e;
        }

        stage(uploadId, IngestionStage.VALIDATING);
        List<CanonicalComponentRecord> records = new ArrayList<>(rawRecords.size());
        List<RowMessage> warnings = new ArrayList<>();
        validate(rawRecords, records, warnings);

        stage(uploadId, IngestionStage.RECONCILING);
        MidpointTracker midpoint = new MidpointTracker(filename, actor);
        BatchResult reconciled = batchReconciler.reconcile(records, batchReconciler.getDefaultBatchSize(), actor, midpoint);
        midpoint.ensureEmitted();

        BatchResult result = reconciled.withMessages(warnings).withUploadId(uploadId);
        stage(uploadId, IngestionStage.COMPLETED);
        uploadHistoryService.completed(uploadId, result);
        uploadProgressService.completed(filename);
        logger.info("Finished ingestion of '{}': {} rows, {} created, {} updated, {} failed, {} warnings",
                filename, result.getTotalRows(), result.getCreated(), result.getUpdated(), result.getFailed(),
                result.getWarnings().size());
        return result;
    }

    /**
     * Decodes and validates the first records of an upload without persisting anything.
     */
    public UploadPreview preview(byte[] payload, PayloadFormat format, String filename) {
        checkSize(payload);
        uploadProgressService.started(filename);
        List<RawRecord> rawRecords;
        try {
            rawRecords = decode(null, payload, format);
        } catch (FatalDecodeException e) {
            logger.warn("Preview of '{}' failed to decode: {}", filename, e.getMessage());
            uploadProgressService.failed(filename);
            throw e;
        }
        uploadProgressService.midpoint(filename);

        List<RawRecord> head = rawRecords.subList(0, Math.min(previewLimit, rawRecords.size()));
        List<CanonicalComponentRecord> records = new ArrayList<>(head.size());
        List<RowMessage> warnings = new ArrayList<>();
        validate(head, records, warnings);

        uploadProgressService.completed(filename);
        logger.info("Previewed '{}': {} of {} rows, {} warnings", filename, records.size(), rawRecords.size(), warnings.size());
        return new UploadPreview(rawRecords.size(), records, warnings);
    }

    private List<RawRecord> decode(UUID uploadId, byte[] payload, PayloadFormat format) {
        stage(uploadId, IngestionStage.DECODING);
        PayloadDecoder decoder = decoders.stream()
                .filter(d -> d.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No decoder registered for " + format));
        List<RawRecord> decoded = decoder.decode(payload);
        stage(uploadId, IngestionStage.EXTRACTING);
        logger.debug("Decoded {} record(s) from {} payload", decoded.size(), format);
        return decoded;
    }

    private void validate(List<RawRecord> rawRecords, List<CanonicalComponentRecord> records, List<RowMessage> warnings) {
        for (RawRecord raw : rawRecords) {
            ValidatedRecord validated = recordValidator.validateAndFix(raw);
            records.add(validated.record());
            for (String warning : validated.warnings()) {
                warnings.add(RowMessage.warning(raw.getRowNumber(), warning));
            }
        }
    }

    private void checkSize(byte[] payload) {
        if (payload.length > maxPayloadBytes) {
            throw new PayloadTooLargeException(payload.length, maxPayloadBytes);
        }
    }

    private static void stage(UUID uploadId, IngestionStage stage) {
        logger.debug("Upload {} -> {}", uploadId != null ? uploadId : "(preview)", stage);
    }

    /**
     * Emits one component_update per saved record and the 50% progress mark once half of the
     * chunks have settled.
     */
    private final class MidpointTracker implements ReconciliationListener {

        private final String filename;
        private final String actor;
        private boolean emitted;

        MidpointTracker(String filename, String actor) {
            this.filename = filename;
            this.actor = actor;
        }

        @Override
        public void onChunkSettled(int chunkNumber, int totalChunks, List<ReconciliationOutcome> outcomes) {
            for (ReconciliationOutcome outcome : outcomes) {
                if (!outcome.isSuccess()) {
                    continue;
                }
                CanonicalComponentRecord record = outcome.getRecord();
                String action = outcome.getKind() == ReconciliationOutcome.Kind.CREATED ? "created" : "updated";
                uploadProgressService.emit(new ComponentUpdateEvent(action, outcome.getExternalKey(),
                        record.getComponentLabel(), record.getTowerName(), actor));
            }
            if (!emitted && chunkNumber * 2 >= totalChunks) {
                ensureEmitted();
            }
        }

        void ensureEmitted() {
            if (!emitted) {
                emitted = true;
                uploadProgressService.midpoint(filename);
            }
        }
    }
}
