package com.componenttracker.service;

import com.componenttracker.model.*;
import com.componenttracker.repository.ComponentRecordRepository;
import com.componenttracker.repository.TowerRepository;
import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates or updates components by external key in bounded chunks.
 *
 * Each chunk runs in its own transaction. When a chunk cannot commit, it is rolled back and
 * every record in it is retried alone, so one bad row only costs itself. Outcomes come back
 * in input order regardless of chunking.
 *
 * Records without an external key get a random {@code COMP-XXXXXXXX} key, which means
 * re-uploading a file without stable identifiers always inserts new rows.
 *
 * Towers are looked up by name and created on first sight in the same transaction as the
 * components that reference them. A tower only counts as created once that transaction commits.
 */
@Service
public class BatchReconciler {

    private static final Logger logger = LoggerFactory.getLogger(BatchReconciler.class);

    static final String GENERATED_KEY_PREFIX = "COMP-";
    static final String AUTO_TOWER_OWNERSHIP = "Auto-Generated";

    private final ComponentRecordRepository componentRecordRepository;
    private final TowerRepository towerRepository;
    private final TransactionTemplate transactionTemplate;
    private final int defaultBatchSize;

    public BatchReconciler(ComponentRecordRepository componentRecordRepository,
                           TowerRepository towerRepository,
                           PlatformTransactionManager transactionManager,
                           @Value("${app.ingestion.batch-size:100}") int defaultBatchSize) {
        this.componentRecordRepository = componentRecordRepository;
        this.towerRepository = towerRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.defaultBatchSize = defaultBatchSize;
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    public BatchResult reconcile(List<CanonicalComponentRecord> records, String actor) {
        return reconcile(records, defaultBatchSize, actor, ReconciliationListener.NONE);
    }

    public BatchResult reconcile(List<CanonicalComponentRecord> records,
                                 int batchSize,
                                 String actor,
                                 ReconciliationListener listener) {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive, was %s", batchSize);
        List<CanonicalComponentRecord> keyed = records.stream().map(BatchReconciler::withExternalKey).toList();
        List<List<CanonicalComponentRecord>> chunks = Lists.partition(keyed, batchSize);

        List<ReconciliationOutcome> outcomes = new ArrayList<>(keyed.size());
        List<RowMessage> errors = new ArrayList<>();
        List<String> towersCreated = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            ChunkResult chunkResult = reconcileChunk(chunks.get(i), actor, i + 1, chunks.size());
            List<ReconciliationOutcome> settled = chunkResult.outcomes();
            outcomes.addAll(settled);
            towersCreated.addAll(chunkResult.towersCreated());
            for (ReconciliationOutcome outcome : settled) {
                if (!outcome.isSuccess()) {
                    errors.add(RowMessage.error(outcome.getSourceRow(),
                            "Failed to save component '" + outcome.getExternalKey() + "': " + outcome.getReason()));
                }
            }
            listener.onChunkSettled(i + 1, chunks.size(), settled);
        }

        BatchResult result = new BatchResult(records.size(), outcomes, errors, towersCreated);
        logger.info("Reconciled {} record(s) in {} chunk(s): {} created, {} updated, {} failed, {} tower(s) created",
                records.size(), chunks.size(), result.getCreated(), result.getUpdated(), result.getFailed(),
                towersCreated.size());
        return result;
    }

    private ChunkResult reconcileChunk(List<CanonicalComponentRecord> chunk, String actor,
                                       int chunkNumber, int totalChunks) {
        try {
            ChunkResult applied = transactionTemplate.execute(status -> {
                TowerCache towers = new TowerCache();
                List<ReconciliationOutcome> results = new ArrayList<>(chunk.size());
                for (CanonicalComponentRecord record : chunk) {
                    results.add(apply(record, actor, towers));
                }
                componentRecordRepository.flush();
                return new ChunkResult(results, towers.created);
            });
            logger.debug("Chunk {}/{} committed ({} records)", chunkNumber, totalChunks, chunk.size());
            return applied;
        } catch (RuntimeException e) {
            logger.warn("Chunk {}/{} ({} records) rolled back, retrying records individually. Reason: {}",
                    chunkNumber, totalChunks, chunk.size(), rootCauseMessage(e));
            List<ReconciliationOutcome> retried = new ArrayList<>(chunk.size());
            List<String> towersCreated = new ArrayList<>();
            for (CanonicalComponentRecord record : chunk) {
                ChunkResult single = reconcileSingle(record, actor);
                retried.addAll(single.outcomes());
                towersCreated.addAll(single.towersCreated());
            }
            return new ChunkResult(retried, towersCreated);
        }
    }

    private ChunkResult reconcileSingle(CanonicalComponentRecord record, String actor) {
        try {
            return transactionTemplate.execute(status -> {
                TowerCache towers = new TowerCache();
                ReconciliationOutcome outcome = apply(record, actor, towers);
                componentRecordRepository.flush();
                return new ChunkResult(List.of(outcome), towers.created);
            });
        } catch (RuntimeException e) {
            String reason = rootCauseMessage(e);
            logger.warn("Row {} (key {}) failed on isolated retry: {}", record.getSourceRow(), record.getExternalKey(), reason);
            return new ChunkResult(List.of(ReconciliationOutcome.failed(record, reason)), List.of());
        }
    }

    private ReconciliationOutcome apply(CanonicalComponentRecord record, String actor, TowerCache towers) {
        OffsetDateTime now = OffsetDateTime.now();
        Tower tower = towers.resolve(record.getTowerName(), actor, now);
        Optional<ComponentRecord> existing = componentRecordRepository.findByExternalKey(record.getExternalKey());
        if (existing.isPresent()) {
            ComponentRecord entity = existing.get();
            entity.applyCanonical(record);
            entity.setTower(tower);
            entity.setUpdatedBy(actor);
            entity.setUpdatedAt(now);
            componentRecordRepository.save(entity);
            return ReconciliationOutcome.updated(record);
        }
        ComponentRecord entity = new ComponentRecord();
        entity.setExternalKey(record.getExternalKey());
        entity.applyCanonical(record);
        entity.setTower(tower);
        entity.setCreatedBy(actor);
        entity.setUpdatedBy(actor);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        componentRecordRepository.save(entity);
        return ReconciliationOutcome.created(record);
    }

    private static CanonicalComponentRecord withExternalKey(CanonicalComponentRecord record) {
        if (record.hasExternalKey()) {
            return record;
        }
        return record.toBuilder().externalKey(generateKey()).build();
    }

    static String generateKey() {
        return GENERATED_KEY_PREFIX + UUID.randomUUID().toString().replace("-", "")
                .substring(0, 8).toUpperCase(Locale.ROOT);
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = Throwables.getRootCause(e);
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private record ChunkResult(List<ReconciliationOutcome> outcomes, List<String> towersCreated) {
    }

    /**
     * Towers seen within one transaction, so a name is only looked up or inserted once per attempt.
     */
    private final class TowerCache {

        private final Map<String, Tower> byName = new HashMap<>();
        private final List<String> created = new ArrayList<>();

        Tower resolve(String name, String actor, OffsetDateTime now) {
            Tower cached = byName.get(name);
            if (cached != null) {
                return cached;
            }
            Tower tower = towerRepository.findByName(name).orElseGet(() -> {
                Tower fresh = new Tower();
                fresh.setName(name);
                fresh.setDescription("Auto-created from file upload");
                fresh.setOwnership(AUTO_TOWER_OWNERSHIP);
                fresh.setCreatedBy(actor);
                fresh.setCreatedAt(now);
                Tower saved = towerRepository.save(fresh);
                created.add(name);
                logger.debug("Creating tower '{}'", name);
                return saved;
            });
            byName.put(name, tower);
            return tower;
        }
    }
}
