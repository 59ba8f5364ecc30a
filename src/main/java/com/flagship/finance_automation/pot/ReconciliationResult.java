package com.flagship.finance_automation.pot;

import com.flagship.finance_automation.transfer.TransferRecord;
import lombok.Value;

@Value
public class ReconciliationResult {
    String potName;
    ReconciliationOutcome outcome;
    long amountMinorUnits;
    String detail;
    /**
     * Present only for {@link ReconciliationOutcome#EXECUTED}.
     */
    TransferRecord record;

    static ReconciliationResult skipped(Pot pot, String detail) {
        return new ReconciliationResult(pot.getName(), ReconciliationOutcome.SKIPPED, 0, detail, null);
    }

    static ReconciliationResult noChange(Pot pot) {
        return new ReconciliationResult(pot.getName(), ReconciliationOutcome.NO_CHANGE, 0,
                "no transfer needed", null);
    }

    static ReconciliationResult awaitingConfirmation(Pot pot, long amount) {
        return new ReconciliationResult(pot.getName(), ReconciliationOutcome.AWAITING_CONFIRMATION, amount,
                "amount exceeds the automatic top-up limit", null);
    }

    static ReconciliationResult executed(Pot pot, TransferRecord record) {
        return new ReconciliationResult(pot.getName(), ReconciliationOutcome.EXECUTED,
                record.getAmountMinorUnits(), record.getStatus().name(), record);
    }
}
