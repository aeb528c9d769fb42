package com.componenttracker.service;

import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.RawRecord;

import java.util.List;

/**
 * Decodes one uploaded payload into raw records, one per data row or JSON element.
 */
public interface PayloadDecoder {

    boolean supports(PayloadFormat format);

    /**
     * @throws FatalDecodeException when the payload cannot be parsed in this format at all
     */
    List<RawRecord> decode(byte[] payload);
}
