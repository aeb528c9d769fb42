package com.componenttracker.service;

import com.componenttracker.model.BatchResult;
import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.UploadRecord;
import com.componenttracker.model.UploadStatus;
import com.componenttracker.repository.UploadRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persists one {@link UploadRecord} per ingestion attempt.
 *
 * Each write commits on its own through the repository, independent of the component chunk
 * transactions. A failure here is logged and ingestion carries on without history.
 */
@Service
public class UploadHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(UploadHistoryService.class);

    private final UploadRecordRepository uploadRecordRepository;

    public UploadHistoryService(UploadRecordRepository uploadRecordRepository) {
        this.uploadRecordRepository = uploadRecordRepository;
    }

    /**
     * Records the start of an upload.
     *
     * @return the upload id, or {@code null} when the record could not be written
     */
    public UUID start(String filename, String contentType, PayloadFormat format, long sizeBytes, String actor) {
        try {
            UploadRecord upload = new UploadRecord();
            upload.setFilename(filename);
            upload.setContentType(contentType);
            upload.setPayloadFormat(format.name());
            upload.setSizeBytes(sizeBytes);
            upload.setActor(actor);
            upload.setStatus(UploadStatus.PROCESSING);
            upload.setReceivedAt(OffsetDateTime.now());
            return uploadRecordRepository.save(upload).getId();
        } catch (RuntimeException e) {
            logger.warn("Could not record upload of '{}' (continuing without history). Reason: {}", filename, e.getMessage());
            return null;
        }
    }

    public void completed(UUID uploadId, BatchResult result) {
        update(uploadId, upload -> {
            upload.setStatus(UploadStatus.COMPLETED);
            upload.setCreatedCount(result.getCreated());
            upload.setUpdatedCount(result.getUpdated());
            upload.setFailedCount(result.getFailed());
            upload.setTotalRows(result.getTotalRows());
            upload.setMessages(String.join("\n", result.formattedMessages()));
        });
    }

    public void decodeFailed(UUID uploadId, String reason) {
        update(uploadId, upload -> {
            upload.setStatus(UploadStatus.DECODE_FAILED);
            upload.setMessages(reason);
        });
    }

    public Optional<UploadRecord> find(UUID id) {
        return uploadRecordRepository.findById(id);
    }

    public List<UploadRecord> findByActor(String actor) {
        return uploadRecordRepository.findAllByActorOrderByReceivedAtDesc(actor);
    }

    private void update(UUID uploadId, Consumer<UploadRecord> change) {
        if (uploadId == null) {
            return;
        }
        try {
            uploadRecordRepository.findById(uploadId).ifPresent(upload -> {
                change.accept(upload);
                upload.setCompletedAt(OffsetDateTime.now());
                uploadRecordRepository.save(upload);
            });
        } catch (RuntimeException e) {
            logger.warn("Could not update upload record {}. Reason: {}", uploadId, e.getMessage());
        }
    }
}
