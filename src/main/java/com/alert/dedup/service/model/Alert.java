package com.alert.dedup.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A monitoring alert as handed over by an ingestion adapter.
 *
 * Fields are kept exactly as the producer sent them. Defaults such as
 * {@code UNKNOWN} or {@code unknown-server} are applied by the components
 * that read the fields, so a missing value stays observable.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert {

    public static final String DEFAULT_TYPE = "UNKNOWN";
    public static final String DEFAULT_CLIENT = "unknown-client";
    public static final String DEFAULT_SERVER = "unknown-server";

    /**
     * Opaque identifier, not part of the fingerprint.
     */
    private String id;

    /**
     * Raw timestamp: ISO-8601 or epoch milliseconds. May be absent or invalid.
     */
    private String timestamp;

    /**
     * Category tag, e.g. CPU_HIGH.
     */
    private String type;

    /**
     * CRITICAL, HIGH, MEDIUM or LOW. Anything else ranks below LOW.
     */
    private String severity;

    private String client;

    private String server;

    private String message;

    /**
     * Open key/value map, e.g. currentValue and threshold.
     */
    private Map<String, Object> metadata;

    private boolean acknowledged;

    private boolean resolved;

    @JsonIgnore
    public String getTypeOrDefault() {
        return type != null ? type : DEFAULT_TYPE;
    }

    @JsonIgnore
    public String getClientOrDefault() {
        return client != null ? client : DEFAULT_CLIENT;
    }

    @JsonIgnore
    public String getServerOrDefault() {
        return server != null ? server : DEFAULT_SERVER;
    }

    @JsonIgnore
    public String getMessageOrDefault() {
        return message != null ? message : "";
    }

    /**
     * Reads a metadata entry, tolerating a missing map.
     */
    public Object metadataValue(String key) {
        return metadata != null ? metadata.get(key) : null;
    }

    /**
     * True when the alert carries no field at all, as produced by an empty JSON object.
     */
    @JsonIgnore
    public boolean isBlank() {
        return id == null
                && timestamp == null
                && type == null
                && severity == null
                && client == null
                && server == null
                && message == null
                && (metadata == null || metadata.isEmpty())
                && !acknowledged
                && !resolved;
    }
}
