package com.flagship.finance_automation.transfer;

import lombok.Value;

/**
 * What is sent to the transfer provider. The client idempotency key is the ledger key.
 */
@Value
public class TransferRequest {
    TransferEndpoint source;
    TransferEndpoint destination;
    long amountMinorUnits;
    String clientIdempotencyKey;
}
