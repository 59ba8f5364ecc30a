package com.flagship.finance_automation.pot;

public enum ReconciliationOutcome {
    /**
     * Inputs missing, stale, unaffordable or out of bounds; nothing was decided.
     */
    SKIPPED,
    /**
     * The pot already matches its target, or the decision is already committed.
     */
    NO_CHANGE,
    /**
     * The top-up exceeds the automatic limit; a human was asked to confirm.
     */
    AWAITING_CONFIRMATION,
    /**
     * A transfer was executed; see the record for its final status.
     */
    EXECUTED
}
