package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.engine.AlertProcessingException;
import com.alert.dedup.service.model.Alert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SuppressionRuleEngineTest {

    private final SuppressionRuleEngine engine = new SuppressionRuleEngine(DefaultSuppressionRules.create());

    // ==================== Default rule table ====================

    @ParameterizedTest(name = "{0}/{1} currentValue={2} -> {3}")
    @CsvSource({
            "CPU_HIGH,      LOW,    70,  CPU usage below critical threshold",
            "CPU_HIGH,      MEDIUM, 94,  CPU usage below critical threshold",
            "MEMORY_HIGH,   LOW,    80,  Memory usage not critical",
            "DISK_FULL,     LOW,    97,  Disk usage not critical",
            "SSL_EXPIRY,    LOW,    30,  SSL certificate has sufficient time before expiry",
            "LOGIN_FAILED,  LOW,    3,   Login attempts below security threshold",
            "BACKUP_FAILED, MEDIUM, 0,   Low priority backup issue",
            "BACKUP_COMPLETED, LOW, 0,   Low priority backup issue",
            "NETWORK_TIMEOUT, HIGH, 0,   Secondary effect of primary incident"
    })
    void defaultRulesSuppressNoise(String type, String severity, int currentValue, String reason) {
        Alert alert = alert(type, severity, "Threshold alert on web-01", currentValue);

        SuppressionDecision decision = engine.evaluate(alert);

        assertThat(decision.suppress()).isTrue();
        assertThat(decision.reason()).isEqualTo(reason);
    }

    @ParameterizedTest(name = "{0}/{1} currentValue={2} is kept")
    @CsvSource({
            "CPU_HIGH,      LOW,    98",
            "CPU_HIGH,      HIGH,   50",
            "MEMORY_HIGH,   HIGH,   50",
            "MEMORY_HIGH,   LOW,    95",
            "DISK_FULL,     LOW,    98",
            "SSL_EXPIRY,    LOW,    7",
            "LOGIN_FAILED,  LOW,    10",
            "BACKUP_FAILED, HIGH,   0",
            "NETWORK_TIMEOUT, CRITICAL, 0"
    })
    void defaultRulesKeepActionableAlerts(String type, String severity, int currentValue) {
        Alert alert = alert(type, severity, "Threshold alert on web-01", currentValue);

        assertThat(engine.evaluate(alert).suppress()).isFalse();
    }

    @Test
    @DisplayName("Low CPU alert at 70 is suppressed, at 98 it is kept")
    void cpuThreshold() {
        assertThat(engine.evaluate(alert("CPU_HIGH", "LOW", "CPU usage high", 70)).reason())
                .isEqualTo("CPU usage below critical threshold");
        assertThat(engine.evaluate(alert("CPU_HIGH", "LOW", "CPU usage high", 98)).suppress())
                .isFalse();
    }

    @Test
    @DisplayName("Metadata values are read as leading integers")
    void metadataValuesAreParsedLeniently() {
        Alert percentString = Alert.builder().type("CPU_HIGH").severity("LOW")
                .metadata(Map.of("currentValue", "72%")).build();
        Alert fraction = Alert.builder().type("DISK_FULL").severity("LOW")
                .metadata(Map.of("currentValue", 97.9)).build();
        Alert garbage = Alert.builder().type("CPU_HIGH").severity("LOW")
                .metadata(Map.of("currentValue", "n/a")).build();
        Alert noMetadata = Alert.builder().type("CPU_HIGH").severity("LOW").build();

        assertThat(engine.evaluate(percentString).suppress()).isTrue();
        assertThat(engine.evaluate(fraction).suppress()).isTrue();
        assertThat(engine.evaluate(garbage).suppress()).isFalse();
        assertThat(engine.evaluate(noMetadata).suppress()).isFalse();
    }

    @Test
    @DisplayName("Informational text in message or type is suppressed")
    void informationalAlerts() {
        assertThat(engine.evaluate(alert("DEPLOY", "HIGH", "INFO: deployment finished", 0)).reason())
                .isEqualTo("Informational alert");
        assertThat(engine.evaluate(alert("JOB", "HIGH", "Nightly job completed successfully", 0)).reason())
                .isEqualTo("Informational alert");
        assertThat(engine.evaluate(alert("HEALTH_CHECK", "HIGH", "endpoint ok", 0)).reason())
                .isEqualTo("Informational alert");
    }

    @Test
    @DisplayName("Resolved and acknowledged alerts are suppressed")
    void flagRules() {
        Alert resolved = alert("SERVICE_DOWN", "HIGH", "api unreachable", 0).toBuilder().resolved(true).build();
        Alert acknowledged = alert("SERVICE_DOWN", "HIGH", "api unreachable", 0).toBuilder().acknowledged(true).build();

        assertThat(engine.evaluate(resolved).reason()).isEqualTo("Alert already resolved");
        assertThat(engine.evaluate(acknowledged).reason()).isEqualTo("Alert already acknowledged");
    }

    @Test
    @DisplayName("Medium alerts are suppressed unless service-affecting")
    void mediumSeverityRule() {
        assertThat(engine.evaluate(alert("QUEUE_DEPTH", "MEDIUM", "Queue depth growing", 0)).reason())
                .isEqualTo("Medium priority non-service-affecting alert");
        assertThat(engine.evaluate(alert("SERVICE_DOWN", "MEDIUM", "api unreachable", 0)).suppress())
                .isFalse();
        assertThat(engine.evaluate(alert("QUEUE_DEPTH", "MEDIUM", "Customer-facing OUTAGE risk", 0)).suppress())
                .isFalse();
    }

    @Test
    @DisplayName("First matching rule decides the reason")
    void firstMatchWins() {
        // matches both Low CPU Alerts and Medium Severity Non-Critical
        SuppressionDecision decision = engine.evaluate(alert("CPU_HIGH", "MEDIUM", "CPU usage elevated", 80));

        assertThat(decision.ruleName()).isEqualTo("Low CPU Alerts");
    }

    // ==================== Failing rules ====================

    @Test
    @DisplayName("Medium alert without a type fails open")
    void missingTypeFailsOpen() {
        Alert alert = Alert.builder().id("no-type").severity("MEDIUM").message("something happened").build();

        SuppressionDecision decision = engine.evaluate(alert);

        assertThat(decision.suppress()).isFalse();
        assertThat(decision.failures())
                .singleElement()
                .satisfies(failure -> {
                    assertThat(failure.getErrorCode()).isEqualTo(AlertProcessingException.SUPPRESSION_RULE_FAILED);
                    assertThat(failure.getAlertId()).isEqualTo("no-type");
                    assertThat(failure.getMessage()).contains("Medium Severity Non-Critical");
                });
    }

    @Test
    @DisplayName("A throwing rule is skipped and later rules still run")
    void throwingRuleIsSkipped() {
        SuppressionRule broken = new SuppressionRule() {
            @Override
            public String getName() {
                return "Broken";
            }

            @Override
            public String getReason() {
                return "never";
            }

            @Override
            public boolean matches(Alert alert) {
                throw new IllegalStateException("boom");
            }
        };
        SuppressionRule resolved = new FlagRule("Resolved", "Alert already resolved", FlagRule.Flag.RESOLVED);
        var customEngine = new SuppressionRuleEngine(List.of(broken, resolved));

        SuppressionDecision decision = customEngine.evaluate(Alert.builder().type("X").resolved(true).build());

        assertThat(decision.suppress()).isTrue();
        assertThat(decision.reason()).isEqualTo("Alert already resolved");
        assertThat(decision.failures()).hasSize(1);
        assertThat(decision.failures().get(0).getCause()).hasMessage("boom");
    }

    @Test
    @DisplayName("Empty rule list never suppresses")
    void emptyRuleList() {
        var emptyEngine = new SuppressionRuleEngine(List.of());

        assertThat(emptyEngine.evaluate(alert("CPU_HIGH", "LOW", "cpu", 10)).suppress()).isFalse();
    }

    private static Alert alert(String type, String severity, String message, int currentValue) {
        return Alert.builder()
                .id(type + "-" + severity)
                .type(type)
                .severity(severity)
                .server("web-01")
                .client("acme")
                .message(message)
                .metadata(Map.of("currentValue", currentValue))
                .build();
    }
}
