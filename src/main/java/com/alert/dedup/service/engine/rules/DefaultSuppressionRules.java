package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.engine.rules.FlagRule.Flag;
import com.alert.dedup.service.engine.rules.ThresholdRule.Comparison;
import com.alert.dedup.service.engine.rules.TypeSeverityRule.Clause;

import java.util.List;
import java.util.Set;

/**
 * The built-in noise suppression rule set, in evaluation order.
 */
public final class DefaultSuppressionRules {

    private static final Set<String> LOW = Set.of("LOW");
    private static final Set<String> LOW_OR_MEDIUM = Set.of("LOW", "MEDIUM");

    private DefaultSuppressionRules() {
    }

    public static List<SuppressionRule> create() {
        return List.of(
                new ThresholdRule("Low CPU Alerts",
                        "CPU usage below critical threshold",
                        "CPU_HIGH", LOW_OR_MEDIUM, Comparison.BELOW, 95),

                new ThresholdRule("Low Memory Alerts",
                        "Memory usage not critical",
                        "MEMORY_HIGH", LOW, Comparison.BELOW, 95),

                new TextPatternRule("Informational Alerts",
                        "Informational alert",
                        List.of("informational", "info:", "notice:", "completed successfully"),
                        List.of("system_info", "health_check")),

                new FlagRule("Auto-resolved Alerts",
                        "Alert already resolved",
                        Flag.RESOLVED),

                new ThresholdRule("Low Severity Disk Alerts",
                        "Disk usage not critical",
                        "DISK_FULL", LOW, Comparison.BELOW, 98),

                new FlagRule("Acknowledged Alerts",
                        "Alert already acknowledged",
                        Flag.ACKNOWLEDGED),

                // currentValue is days left on the certificate
                new ThresholdRule("SSL Expiry Low Priority",
                        "SSL certificate has sufficient time before expiry",
                        "SSL_EXPIRY", LOW, Comparison.ABOVE, 7),

                new TypeSeverityRule("Backup Alerts Low Priority",
                        "Low priority backup issue",
                        List.of(Clause.of(Set.of("BACKUP_FAILED", "BACKUP_COMPLETED"), LOW_OR_MEDIUM))),

                // currentValue is the number of failed attempts
                new ThresholdRule("Login Failed Low Count",
                        "Login attempts below security threshold",
                        "LOGIN_FAILED", LOW, Comparison.BELOW, 10),

                new MediumSeverityRule("Medium Severity Non-Critical",
                        "Medium priority non-service-affecting alert",
                        List.of("SERVICE_DOWN"),
                        List.of("critical", "outage")),

                new TypeSeverityRule("High Volume Alert Types",
                        "Secondary effect of primary incident",
                        List.of(
                                Clause.excluding(Set.of("NETWORK_TIMEOUT"), Set.of("CRITICAL")),
                                Clause.of(Set.of("BACKUP_FAILED"), LOW)))
        );
    }
}
