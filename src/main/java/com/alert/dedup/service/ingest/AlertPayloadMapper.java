package com.alert.dedup.service.ingest;

import com.alert.dedup.service.model.Alert;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Converts decoded alert payloads into a pipeline batch.
 *
 * Accepted bodies, in order: an object with an {@code alerts} array or
 * object, an object with an {@code alert} object, a JSON array of alerts,
 * and a single alert object. Entries that are not objects, or are empty
 * objects, become null entries, which the pipeline counts as malformed.
 *
 * Fields are read one by one. A field of the wrong JSON type is treated as
 * absent; it never discards the rest of the alert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertPayloadMapper {

    static final String ALERTS_ENVELOPE = "alerts";
    static final String ALERT_ENVELOPE = "alert";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<Alert> toBatch(JsonNode body) {
        JsonNode entries = unwrap(body);
        if (entries == null || !entries.isArray()) {
            return Collections.singletonList(toAlert(entries, 0));
        }

        List<Alert> batch = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            batch.add(toAlert(entries.get(i), i));
        }
        return batch;
    }

    private static JsonNode unwrap(JsonNode body) {
        if (body == null || !body.isObject()) {
            return body;
        }
        if (body.hasNonNull(ALERTS_ENVELOPE)) {
            return body.get(ALERTS_ENVELOPE);
        }
        if (body.hasNonNull(ALERT_ENVELOPE)) {
            return body.get(ALERT_ENVELOPE);
        }
        return body;
    }

    private Alert toAlert(JsonNode node, int index) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            log.debug("Payload entry {} is not an alert object: {}", index, node);
            return null;
        }

        return Alert.builder()
                .id(scalar(node, "id", index))
                .timestamp(scalar(node, "timestamp", index))
                .type(scalar(node, "type", index))
                .severity(scalar(node, "severity", index))
                .client(scalar(node, "client", index))
                .server(scalar(node, "server", index))
                .message(scalar(node, "message", index))
                .metadata(metadata(node, index))
                .acknowledged(flag(node, "acknowledged"))
                .resolved(flag(node, "resolved"))
                .build();
    }

    private static String scalar(JsonNode node, String field, int index) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            log.debug("Ignoring non-scalar '{}' in payload entry {}", field, index);
            return null;
        }
        return value.asText();
    }

    private Map<String, Object> metadata(JsonNode node, int index) {
        JsonNode value = node.get("metadata");
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            log.debug("Ignoring non-object metadata in payload entry {}", index);
            return null;
        }
        return objectMapper.convertValue(value, METADATA_TYPE);
    }

    // only a JSON true sets a flag; "true" as a string does not
    private static boolean flag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isBoolean() && value.booleanValue();
    }
}
