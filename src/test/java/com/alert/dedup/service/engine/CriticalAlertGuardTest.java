package com.alert.dedup.service.engine;

import com.alert.dedup.service.engine.rules.SuppressionDecision;
import com.alert.dedup.service.engine.rules.SuppressionRule;
import com.alert.dedup.service.engine.rules.FlagRule;
import com.alert.dedup.service.model.Alert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CriticalAlertGuardTest {

    private final CriticalAlertGuard guard = new CriticalAlertGuard(PipelineSettings.DEFAULT_CRITICAL_KEYWORDS);

    @Test
    @DisplayName("Keywords match message or type, ignoring case")
    void keywordsMatchIgnoringCase() {
        assertThat(guard.isCritical(Alert.builder().message("Payment API is DOWN").build())).isTrue();
        assertThat(guard.isCritical(Alert.builder().type("BACKUP_FAILED").build())).isTrue();
        assertThat(guard.isCritical(Alert.builder().message("Partial Outage in eu-west").build())).isTrue();
        assertThat(guard.isCritical(Alert.builder().type("CPU_HIGH").message("CPU at 91%").build())).isFalse();
    }

    @Test
    @DisplayName("Substring matches count, e.g. 'download' contains 'down'")
    void substringMatchesCount() {
        assertThat(guard.isCritical(Alert.builder().message("slow download speed").build())).isTrue();
    }

    @Test
    @DisplayName("Absent message and type are not critical")
    void absentTextIsNotCritical() {
        assertThat(guard.isCritical(Alert.builder().id("x").build())).isFalse();
    }

    @Test
    @DisplayName("Custom keyword set replaces the defaults")
    void customKeywords() {
        var custom = new CriticalAlertGuard(List.of("PAGER"));

        assertThat(custom.isCritical(Alert.builder().message("pager escalation").build())).isTrue();
        assertThat(custom.isCritical(Alert.builder().message("service down").build())).isFalse();
    }

    @Test
    @DisplayName("Critical alerts override a suppression decision")
    void overrideClearsSuppression() {
        SuppressionRule rule = new FlagRule("Acknowledged Alerts", "Alert already acknowledged", FlagRule.Flag.ACKNOWLEDGED);
        Alert alert = Alert.builder().type("SERVICE_DOWN").message("critical: db down").acknowledged(true).build();

        SuppressionDecision decision = guard.enforce(alert, SuppressionDecision.suppress(rule, List.of()));

        assertThat(decision.suppress()).isFalse();
        assertThat(decision.reason()).isNull();
        assertThat(decision.ruleName()).isNull();
    }

    @Test
    @DisplayName("Non-critical alerts keep the rule decision")
    void nonCriticalKeepsDecision() {
        SuppressionRule rule = new FlagRule("Acknowledged Alerts", "Alert already acknowledged", FlagRule.Flag.ACKNOWLEDGED);
        Alert alert = Alert.builder().type("CPU_HIGH").message("cpu busy").acknowledged(true).build();
        SuppressionDecision original = SuppressionDecision.suppress(rule, List.of());

        assertThat(guard.enforce(alert, original)).isSameAs(original);
    }
}
