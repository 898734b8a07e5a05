package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.model.Alert;

/**
 * Suppresses alerts that an operator or the source system already handled.
 */
public class FlagRule extends AbstractSuppressionRule {

    public enum Flag {
        RESOLVED,
        ACKNOWLEDGED
    }

    private final Flag flag;

    public FlagRule(String name, String reason, Flag flag) {
        super(name, reason);
        this.flag = flag;
    }

    @Override
    public boolean matches(Alert alert) {
        return switch (flag) {
            case RESOLVED -> alert.isResolved();
            case ACKNOWLEDGED -> alert.isAcknowledged();
        };
    }
}
