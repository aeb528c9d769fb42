package com.componenttracker.service;

import com.componenttracker.model.*;
import com.componenttracker.repository.ComponentRecordRepository;
import com.componenttracker.repository.TowerRepository;
import com.componenttracker.repository.UploadRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ComponentIngestionIntegrationTest {

    private static final String HEADER = "componentId,name,tower,appGroup,componentType,complexity,status,year,month\n";

    @Autowired
    private ComponentIngestionService ingestionService;

    @Autowired
    private BatchReconciler batchReconciler;

    @Autowired
    private RecordValidator recordValidator;

    @Autowired
    private ComponentExportService exportService;

    @Autowired
    private ComponentRecordRepository componentRecordRepository;

    @Autowired
    private UploadRecordRepository uploadRecordRepository;

    @Autowired
    private TowerRepository towerRepository;

    @BeforeEach
    void clean() {
        componentRecordRepository.deleteAll();
        towerRepository.deleteAll();
        uploadRecordRepository.deleteAll();
    }

    @Test
    void reingestingSamePayloadUpdatesInsteadOfCreating() {
        byte[] payload = csv(HEADER
                + "CMP-1,Ledger,Finance,Accounting,Service,Low,Released,2025,3\n"
                + "CMP-2,Vault,Security,Platform,Library,High,Planned,2026,1\n"
                + "CMP-3,Gateway,Platform,Edge,Service,Medium,Testing,2024,11\n");

        BatchResult first = ingestionService.ingest(payload, PayloadFormat.CSV, "components.csv", "text/csv", "alice");
        BatchResult second = ingestionService.ingest(payload, PayloadFormat.CSV, "components.csv", "text/csv", "bob");

        assertThat(first.getCreated()).isEqualTo(3);
        assertThat(first.getUpdated()).isZero();
        assertThat(second.getCreated()).isZero();
        assertThat(second.getUpdated()).isEqualTo(3);
        assertThat(componentRecordRepository.count()).isEqualTo(3);

        ComponentRecord gateway = componentRecordRepository.findByExternalKey("CMP-3").orElseThrow();
        assertThat(gateway.getStatus()).isEqualTo(CanonicalStatus.IN_DEVELOPMENT);
        assertThat(gateway.getCreatedBy()).isEqualTo("alice");
        assertThat(gateway.getUpdatedBy()).isEqualTo("bob");
    }

    @Test
    void createsTowersOnFirstSightOnly() {
        byte[] payload = csv(HEADER
                + "CMP-70,Ledger,Finance,Accounting,Service,Low,Released,2025,3\n"
                + "CMP-71,Vault,Security,Platform,Library,High,Planned,2026,1\n"
                + "CMP-72,Payroll,Finance,HR,Service,Medium,Planned,2026,2\n");

        BatchResult first = ingestionService.ingest(payload, PayloadFormat.CSV, "towers.csv", "text/csv", "alice");
        BatchResult second = ingestionService.ingest(payload, PayloadFormat.CSV, "towers.csv", "text/csv", "alice");

        assertThat(first.getTowersCreated()).containsExactly("Finance", "Security");
        assertThat(second.getTowersCreated()).isEmpty();
        assertThat(towerRepository.count()).isEqualTo(2);

        Tower finance = towerRepository.findByName("Finance").orElseThrow();
        assertThat(finance.getOwnership()).isEqualTo(BatchReconciler.AUTO_TOWER_OWNERSHIP);
        assertThat(finance.getCreatedBy()).isEqualTo("alice");
        assertThat(componentRecordRepository.findAll())
                .filteredOn(c -> "Finance".equals(c.getTowerName()))
                .extracting(c -> c.getTower().getId())
                .containsOnly(finance.getId());
    }

    @Test
    void autoFixesMissingNameAndInvalidComplexity() {
        byte[] payload = csv(HEADER
                + "CMP-10,,Finance,Accounting,Service,Low,Released,2025,3\n"
                + "CMP-11,Vault,Security,Platform,Library,invalid,Planned,2026,1\n"
                + "CMP-12,Gateway,Platform,Edge,Service,Medium,Released,2024,11\n");

        BatchResult result = ingestionService.ingest(payload, PayloadFormat.CSV, "scenario.csv", "text/csv", "alice");

        assertThat(result.getCreated()).isEqualTo(3);
        assertThat(result.getFailed()).isZero();
        assertThat(result.getWarnings()).hasSize(2);
        assertThat(result.getErrors()).isEmpty();

        List<ComponentRecord> stored = componentRecordRepository.findAllByOrderByTowerNameAscComponentLabelAsc();
        assertThat(stored).hasSize(3).allSatisfy(component -> {
            assertThat(component.getComponentLabel()).isNotBlank();
            assertThat(component.getTowerName()).isNotBlank();
            assertThat(component.getComplexity()).isNotNull();
            assertThat(component.getStatus()).isNotNull();
        });
        assertThat(componentRecordRepository.findByExternalKey("CMP-10").orElseThrow().getComponentLabel())
                .isEqualTo("Component 1");
        assertThat(componentRecordRepository.findByExternalKey("CMP-11").orElseThrow().getComplexity())
                .isEqualTo(CanonicalComplexity.MEDIUM);

        UploadRecord upload = uploadRecordRepository.findById(result.getUploadId()).orElseThrow();
        assertThat(upload.getStatus()).isEqualTo(UploadStatus.COMPLETED);
        assertThat(upload.getCreatedCount()).isEqualTo(3);
    }

    @Test
    void invalidJsonLeavesStoreUntouched() {
        ingestionService.ingest(csv(HEADER + "CMP-20,Ledger,Finance,Accounting,Service,Low,Released,2025,3\n"),
                PayloadFormat.CSV, "seed.csv", "text/csv", "alice");
        long before = componentRecordRepository.count();

        assertThatThrownBy(() -> ingestionService.ingest(
                "[{\"componentId\": \"CMP-21\", \"name\": ".getBytes(StandardCharsets.UTF_8),
                PayloadFormat.JSON, "broken.json", "application/json", "alice"))
                .isInstanceOf(FatalDecodeException.class);

        assertThat(componentRecordRepository.count()).isEqualTo(before);
        assertThat(uploadRecordRepository.findAllByActorOrderByReceivedAtDesc("alice"))
                .extracting(UploadRecord::getStatus)
                .contains(UploadStatus.DECODE_FAILED);
    }

    @Test
    void jsonWithTrailingContentIsRejectedWithoutWrites() {
        long before = componentRecordRepository.count();

        assertThatThrownBy(() -> ingestionService.ingest(
                "[{\"componentId\":\"CMP-22\",\"name\":\"Ledger\"}]]".getBytes(StandardCharsets.UTF_8),
                PayloadFormat.JSON, "trailing.json", "application/json", "alice"))
                .isInstanceOf(FatalDecodeException.class);
        assertThatThrownBy(() -> ingestionService.ingest(
                "{\"componentId\":\"CMP-23\",\"name\":\"Vault\"} garbage".getBytes(StandardCharsets.UTF_8),
                PayloadFormat.JSON, "garbage.json", "application/json", "alice"))
                .isInstanceOf(FatalDecodeException.class);

        assertThat(componentRecordRepository.count()).isEqualTo(before);
        assertThat(componentRecordRepository.findByExternalKey("CMP-22")).isEmpty();
        assertThat(componentRecordRepository.findByExternalKey("CMP-23")).isEmpty();
    }

    @Test
    void failingRecordIsIsolatedFromItsChunk() {
        int batchSize = 3;
        String overlongName = "x".repeat(250);
        List<CanonicalComponentRecord> records = List.of(
                validated(1, "CMP-30", "Ledger"),
                validated(2, "CMP-31", overlongName),
                validated(3, "CMP-32", "Vault"),
                validated(4, "CMP-33", "Gateway"));

        BatchResult result = batchReconciler.reconcile(records, batchSize, "alice", ReconciliationListener.NONE);

        assertThat(result.getCreated()).isEqualTo(batchSize);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).rowIndex()).isEqualTo(2);
        assertThat(result.getErrors().get(0).message()).startsWith("Failed to save component 'CMP-31'");
        assertThat(componentRecordRepository.findByExternalKey("CMP-31")).isEmpty();
        assertThat(componentRecordRepository.count()).isEqualTo(3);
        // the rolled back chunk attempt must not count the tower a second time
        assertThat(result.getTowersCreated()).containsExactly("Finance");
        assertThat(towerRepository.count()).isEqualTo(1);
    }

    @Test
    void repeatedKeyWithinOneUploadBecomesAnUpdate() {
        byte[] payload = csv(HEADER
                + "CMP-40,Ledger,Finance,Accounting,Service,Low,Released,2025,3\n"
                + "CMP-40,Ledger v2,Finance,Accounting,Service,High,Released,2025,4\n");

        BatchResult result = ingestionService.ingest(payload, PayloadFormat.CSV, "dupes.csv", "text/csv", "alice");

        assertThat(result.getCreated()).isEqualTo(1);
        assertThat(result.getUpdated()).isEqualTo(1);
        assertThat(componentRecordRepository.findByExternalKey("CMP-40").orElseThrow().getComponentLabel())
                .isEqualTo("Ledger v2");
    }

    @Test
    void previewDoesNotPersist() {
        byte[] payload = csv(HEADER + "CMP-50,Ledger,Finance,Accounting,Service,Low,Released,2025,3\n");

        UploadPreview preview = ingestionService.preview(payload, PayloadFormat.CSV, "preview.csv");

        assertThat(preview.previewRows()).isEqualTo(1);
        assertThat(componentRecordRepository.count()).isZero();
        assertThat(uploadRecordRepository.count()).isZero();
    }

    @Test
    void exportListsStoredComponents() {
        ingestionService.ingest(csv(HEADER
                        + "CMP-60,Ledger,Finance,Accounting,Service,Low,Released,2025,3\n"
                        + "CMP-61,\"Vault, Secrets\",Security,Platform,Library,High,Planned,2026,1\n"),
                PayloadFormat.CSV, "export.csv", "text/csv", "alice");

        String exported = new String(exportService.exportCsv(), StandardCharsets.UTF_8);

        assertThat(exported).startsWith("componentId,name,tower,appGroup,componentType,complexity,status");
        assertThat(exported).contains("CMP-60,Ledger,Finance,Accounting,Service,Low,Released");
        assertThat(exported).contains("\"Vault, Secrets\"");
    }

    private CanonicalComponentRecord validated(int row, String key, String name) {
        RawRecord raw = new RawRecord(row, java.util.Map.of(
                "componentId", key,
                "name", name,
                "tower", "Finance",
                "appGroup", "Accounting",
                "componentType", "Service"));
        return recordValidator.validateAndFix(raw).record();
    }

    private static byte[] csv(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
