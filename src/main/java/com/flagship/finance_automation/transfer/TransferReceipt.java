package com.flagship.finance_automation.transfer;

import lombok.Value;

/**
 * Provider acknowledgement of a completed transfer.
 */
@Value
public class TransferReceipt {
    String externalTransferId;
    /**
     * Pot balance reported by the provider after the transfer, when available.
     */
    Long potBalanceMinorUnits;
}
