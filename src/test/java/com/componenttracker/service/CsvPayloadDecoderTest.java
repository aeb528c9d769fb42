package com.componenttracker.service;

import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvPayloadDecoderTest {

    private final CsvPayloadDecoder decoder = new CsvPayloadDecoder();

    @Test
    void supportsOnlyCsv() {
        assertThat(decoder.supports(PayloadFormat.CSV)).isTrue();
        assertThat(decoder.supports(PayloadFormat.JSON)).isFalse();
    }

    @Test
    void decodesHeaderKeyedRows() {
        String csv = "componentId,Component Name,Tower Name\n"
                + "CMP-1,Billing API,Finance\n"
                + "CMP-2,\"Auth, Gateway\",Security\n";

        List<RawRecord> records = decoder.decode(csv.getBytes(StandardCharsets.UTF_8));

        assertThat(records).hasSize(2);
        assertThat(records.get(0).getRowNumber()).isEqualTo(1);
        assertThat(records.get(0).get("Component Name")).isEqualTo("Billing API");
        assertThat(records.get(1).get("Component Name")).isEqualTo("Auth, Gateway");
        assertThat(records.get(1).get("Tower Name")).isEqualTo("Security");
    }

    @Test
    void stripsByteOrderMarkAndSkipsBlankRows() {
        String csv = "\uFEFFname,tower\n"
                + "Ledger,Finance\n"
                + ",\n"
                + "Vault,Security\n";

        List<RawRecord> records = decoder.decode(csv.getBytes(StandardCharsets.UTF_8));

        assertThat(records).extracting(r -> r.get("name")).containsExactly("Ledger", "Vault");
        assertThat(records).extracting(RawRecord::getRowNumber).containsExactly(1, 3);
    }

    @Test
    void rejectsMalformedUtf8() {
        byte[] payload = {'n', 'a', 'm', 'e', '\n', 'L', 'e', 'd', (byte) 0xC3, '(', 'r', '\n'};

        assertThatThrownBy(() -> decoder.decode(payload))
                .isInstanceOf(FatalDecodeException.class)
                .hasMessageStartingWith("Failed to process CSV file");
    }

    @Test
    void keepsMultiByteCharacters() {
        List<RawRecord> records = decoder.decode("name,tower\nZürich Gateway,Façade\n".getBytes(StandardCharsets.UTF_8));

        assertThat(records.get(0).get("name")).isEqualTo("Zürich Gateway");
        assertThat(records.get(0).get("tower")).isEqualTo("Façade");
    }

    @Test
    void headerOnlyPayloadYieldsNoRecords() {
        assertThat(decoder.decode("name,tower\n".getBytes(StandardCharsets.UTF_8))).isEmpty();
    }
}
