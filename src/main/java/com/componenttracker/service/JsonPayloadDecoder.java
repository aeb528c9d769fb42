package com.componenttracker.service;

import com.componenttracker.model.PayloadFormat;
import com.componenttracker.model.RawRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts an array of objects, a single object, or an object wrapping a
 * {@code components} or {@code data} array.
 */
@Component
public class JsonPayloadDecoder implements PayloadDecoder {

    private static final List<String> WRAPPER_KEYS = List.of("components", "data");

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public JsonPayloadDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // content after the root value (e.g. "[...]]" or "{...} junk") is a syntax error
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public boolean supports(PayloadFormat format) {
        return format == PayloadFormat.JSON;
    }

    @Override
    public List<RawRecord> decode(byte[] payload) {
        JsonNode root;
        try {
            root = strictReader.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new FatalDecodeException("Invalid JSON format: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FatalDecodeException("Invalid JSON format: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new FatalDecodeException("Invalid JSON format: payload is empty");
        }
        JsonNode elements = unwrap(root);
        List<RawRecord> rows = new ArrayList<>();
        int rowNumber = 0;
        for (JsonNode element : elements) {
            rowNumber++;
            if (!element.isObject()) {
                throw new FatalDecodeException("Invalid JSON structure: item " + rowNumber + " is not an object");
            }
            RawRecord raw = new RawRecord(rowNumber, toMap(element));
            if (!raw.isBlank()) {
                rows.add(raw);
            }
        }
        return rows;
    }

    private JsonNode unwrap(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        if (root.isObject()) {
            for (String key : WRAPPER_KEYS) {
                JsonNode nested = root.get(key);
                if (nested != null && nested.isArray()) {
                    return nested;
                }
            }
            return objectMapper.createArrayNode().add(root);
        }
        throw new FatalDecodeException("Invalid JSON structure. Expected list or object with 'components' or 'data' key.");
    }

    private static Map<String, Object> toMap(JsonNode node) {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), scalar(field.getValue()));
        }
        return values;
    }

    private static Object scalar(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        // nested structures are kept as their JSON text
        return value.toString();
    }
}
