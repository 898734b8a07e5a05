package com.alert.dedup.service.ingest;

import com.alert.dedup.service.engine.PipelineSettings;
import com.alert.dedup.service.engine.ProcessingPipeline;
import com.alert.dedup.service.model.Alert;
import com.alert.dedup.service.model.ProcessingResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AlertPayloadMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AlertPayloadMapper mapper = new AlertPayloadMapper(objectMapper);

    // ==================== Body shapes ====================

    @Test
    @DisplayName("Array body maps one entry per element")
    void arrayBody() throws Exception {
        JsonNode body = objectMapper.readTree("""
                [
                  {"id": "a-1", "type": "CPU_HIGH", "severity": "LOW",
                   "metadata": {"currentValue": 70}, "acknowledged": true, "extra": "ignored"},
                  {"id": "a-2", "type": "SERVICE_DOWN", "severity": "CRITICAL"}
                ]
                """);

        List<Alert> batch = mapper.toBatch(body);

        assertThat(batch).hasSize(2);
        assertThat(batch.get(0).getId()).isEqualTo("a-1");
        assertThat(batch.get(0).metadataValue("currentValue")).isEqualTo(70);
        assertThat(batch.get(0).isAcknowledged()).isTrue();
        assertThat(batch.get(1).getSeverity()).isEqualTo("CRITICAL");
    }

    @Test
    @DisplayName("Single object body is a batch of one")
    void singleObjectBody() throws Exception {
        List<Alert> batch = mapper.toBatch(objectMapper.readTree("{\"id\": \"solo\", \"type\": \"DISK_FULL\"}"));

        assertThat(batch).singleElement().extracting(Alert::getId).isEqualTo("solo");
    }

    @Test
    @DisplayName("'alerts' envelope holding an array is unwrapped")
    void alertsArrayEnvelope() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"source": "superops", "alerts": [
                  {"id": "e-1", "type": "SERVICE_DOWN", "severity": "CRITICAL", "message": "db down"},
                  {"id": "e-2", "type": "CPU_HIGH", "severity": "LOW"}
                ]}
                """);

        assertThat(mapper.toBatch(body))
                .extracting(Alert::getId)
                .containsExactly("e-1", "e-2");
    }

    @Test
    @DisplayName("'alerts' envelope holding one object is a batch of one")
    void alertsObjectEnvelope() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"alerts": {"id": "e-1", "type": "SERVICE_DOWN"}}
                """);

        assertThat(mapper.toBatch(body)).singleElement().extracting(Alert::getId).isEqualTo("e-1");
    }

    @Test
    @DisplayName("'alert' envelope is unwrapped")
    void alertEnvelope() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"alert": {"id": "e-1", "type": "SERVICE_DOWN"}}
                """);

        assertThat(mapper.toBatch(body)).singleElement().extracting(Alert::getId).isEqualTo("e-1");
    }

    @Test
    @DisplayName("Null envelope values fall back to the single-object path")
    void nullEnvelopeIsIgnored() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"id": "plain", "type": "SERVICE_DOWN", "alerts": null}
                """);

        assertThat(mapper.toBatch(body)).singleElement().extracting(Alert::getId).isEqualTo("plain");
    }

    // ==================== Malformed entries ====================

    @Test
    @DisplayName("Non-object and empty entries become null")
    void malformedEntriesBecomeNull() throws Exception {
        JsonNode body = objectMapper.readTree("""
                [null, {}, 42, "text", [], {"type": "OK"}]
                """);

        List<Alert> batch = mapper.toBatch(body);

        assertThat(batch).hasSize(6);
        assertThat(batch.subList(0, 5)).containsOnlyNulls();
        assertThat(batch.get(5).getType()).isEqualTo("OK");
    }

    @Test
    @DisplayName("Null body is a single malformed entry")
    void nullBody() {
        assertThat(mapper.toBatch(NullNode.getInstance())).containsExactly((Alert) null);
        assertThat(mapper.toBatch(null)).containsExactly((Alert) null);
    }

    // ==================== Lenient fields ====================

    @Test
    @DisplayName("Non-object metadata is dropped, the alert is kept")
    void nonObjectMetadataIsAbsent() throws Exception {
        Alert alert = single("""
                {"id": "m-1", "type": "SERVICE_DOWN", "severity": "CRITICAL", "message": "outage", "metadata": "n/a"}
                """);

        assertThat(alert).isNotNull();
        assertThat(alert.getMetadata()).isNull();
        assertThat(alert.getMessage()).isEqualTo("outage");
    }

    @Test
    @DisplayName("Non-scalar timestamp is dropped, the alert is kept")
    void nonScalarTimestampIsAbsent() throws Exception {
        Alert alert = single("""
                {"id": "t-1", "type": "SERVICE_DOWN", "timestamp": {"s": 1}}
                """);

        assertThat(alert).isNotNull();
        assertThat(alert.getTimestamp()).isNull();
        assertThat(alert.getType()).isEqualTo("SERVICE_DOWN");
    }

    @Test
    @DisplayName("Numeric scalars are read as text, containers in text fields are dropped")
    void scalarFieldsAreReadAsText() throws Exception {
        Alert alert = single("""
                {"id": 1234, "timestamp": 1740823200000, "type": ["CPU_HIGH"], "message": {"text": "x"}, "server": true}
                """);

        assertThat(alert.getId()).isEqualTo("1234");
        assertThat(alert.getTimestamp()).isEqualTo("1740823200000");
        assertThat(alert.getType()).isNull();
        assertThat(alert.getMessage()).isNull();
        assertThat(alert.getServer()).isEqualTo("true");
    }

    @Test
    @DisplayName("Only JSON true sets the acknowledged and resolved flags")
    void flagsRequireJsonTrue() throws Exception {
        Alert strings = single("""
                {"id": "f-1", "acknowledged": "true", "resolved": "true"}
                """);
        Alert booleans = single("""
                {"id": "f-2", "acknowledged": true, "resolved": true}
                """);
        Alert objects = single("""
                {"id": "f-3", "acknowledged": {"nested": true}, "resolved": 1}
                """);

        assertThat(strings.isAcknowledged()).isFalse();
        assertThat(strings.isResolved()).isFalse();
        assertThat(booleans.isAcknowledged()).isTrue();
        assertThat(booleans.isResolved()).isTrue();
        assertThat(objects.isAcknowledged()).isFalse();
        assertThat(objects.isResolved()).isFalse();
    }

    @Test
    @DisplayName("Critical alerts with badly typed fields are still escalated")
    void criticalAlertsSurviveBadFields() throws Exception {
        JsonNode body = objectMapper.readTree("""
                [
                  {"id": "c-1", "type": "SERVICE_DOWN", "severity": "CRITICAL", "server": "db-01",
                   "message": "Checkout outage", "metadata": "n/a"},
                  {"id": "c-2", "type": "SERVICE_DOWN", "severity": "CRITICAL", "server": "db-02",
                   "message": "Checkout outage", "timestamp": {"s": 1}},
                  {"id": "c-3", "type": "SERVICE_DOWN", "severity": "CRITICAL", "server": "db-03",
                   "message": "Checkout outage", "resolved": "true"}
                ]
                """);

        ProcessingResult result = new ProcessingPipeline(PipelineSettings.defaults()).processAlerts(mapper.toBatch(body));

        assertThat(result.getProcessedAlerts())
                .extracting(processed -> processed.getAlert().getId())
                .containsExactlyInAnyOrder("c-1", "c-2", "c-3");
    }

    @Test
    @DisplayName("A string \"true\" flag does not suppress a non-critical alert")
    void stringFlagDoesNotSuppress() throws Exception {
        JsonNode body = objectMapper.readTree("""
                {"id": "disk-1", "type": "DISK_FULL", "severity": "HIGH", "server": "fs-01",
                 "message": "Disk at 99%", "resolved": "true", "acknowledged": "yes"}
                """);

        ProcessingResult result = new ProcessingPipeline(PipelineSettings.defaults()).processAlerts(mapper.toBatch(body));

        assertThat(result.getProcessedAlerts()).hasSize(1);
        assertThat(result.getMetrics().getSuppressed()).isZero();
    }

    private Alert single(String json) throws Exception {
        List<Alert> batch = mapper.toBatch(objectMapper.readTree(json));
        assertThat(batch).hasSize(1);
        return batch.get(0);
    }
}
