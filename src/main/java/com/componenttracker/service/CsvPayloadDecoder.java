package com.componenttracker.service;

import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.RawRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.ByteArrayInputStream;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class CsvPayloadDecoder implements PayloadDecoder {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    @Override
    public boolean supports(PayloadFormat format) {
        return format == PayloadFormat.CSV;
    }

    @Override
    public List<RawRecord> decode(byte[] payload) {
        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(stripBom(payload)), utf8);
             CSVParser parser = new CSVParser(reader, FORMAT)) {
            List<RawRecord> rows = new ArrayList<>();
            int rowNumber = 0;
            for (CSVRecord record : parser) {
                rowNumber++;
                Map<String, Object> row = new LinkedHashMap<>();
                record.toMap().forEach((key, value) -> {
                    if (key != null && !key.isBlank()) {
                        row.put(key.trim(), value);
                    }
                });
                RawRecord raw = new RawRecord(rowNumber, row);
                if (!raw.isBlank()) {
                    rows.add(raw);
                }
            }
            return rows;
        } catch (IOException | RuntimeException e) {
            throw new FatalDecodeException("Failed to process CSV file: " + e.getMessage(), e);
        }
    }

    private static byte[] stripBom(byte[] payload) {
        if (payload.length >= 3 && (payload[0] & 0xFF) == 0xEF && (payload[1] & 0xFF) == 0xBB && (payload[2] & 0xFF) == 0xBF) {
            byte[] trimmed = new byte[payload.length - 3];
            System.arraycopy(payload, 3, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return payload;
    }
}
