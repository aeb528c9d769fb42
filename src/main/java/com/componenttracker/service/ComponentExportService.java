package com.componenttracker.service;

import com.componenttracker.model.ComponentRecord;
import com.componenttracker.repository.ComponentRecordRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes every stored component as CSV, using header names the upload pipeline accepts back.
 */
@Service
public class ComponentExportService {

    private static final Logger logger = LoggerFactory.getLogger(ComponentExportService.class);

    static final String[] HEADERS = {
            "componentId", "name", "tower", "appGroup", "componentType", "complexity", "status",
            "changeType", "month", "year", "description", "releaseDate", "createdAt", "updatedAt"
    };

    private final ComponentRecordRepository componentRecordRepository;

    public ComponentExportService(ComponentRecordRepository componentRecordRepository) {
        this.componentRecordRepository = componentRecordRepository;
    }

    @Transactional(readOnly = true)
    public byte[] exportCsv() {
        List<ComponentRecord> components = componentRecordRepository.findAllByOrderByTowerNameAscComponentLabelAsc();
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADERS).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (ComponentRecord c : components) {
                printer.printRecord(
                        c.getExternalKey(),
                        c.getComponentLabel(),
                        c.getTowerName(),
                        c.getAppGroup(),
                        c.getComponentType(),
                        c.getComplexity().getLabel(),
                        c.getStatus().getLabel(),
                        c.getChangeType(),
                        c.getMonth(),
                        c.getYear(),
                        c.getDescription(),
                        c.getReleaseDate(),
                        c.getCreatedAt(),
                        c.getUpdatedAt());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write component export", e);
        }
        logger.info("Exported {} component(s) to CSV", components.size());
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
