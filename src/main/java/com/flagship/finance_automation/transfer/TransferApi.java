package com.flagship.finance_automation.transfer;

/**
 * The external money-movement capability. Only {@link MoneyMover} calls it.
 *
 * Implementations must forward {@link TransferRequest#getClientIdempotencyKey()}
 * to the provider's own deduplication so a repeated call cannot move money twice.
 */
public interface TransferApi {

    /**
     * @throws TransferRejectedException  the provider definitively refused
     * @throws AmbiguousTransferException the outcome is unknown (timeout, 5xx)
     * @throws TransientTransferException the request was provably not processed (429, connect refused)
     */
    TransferReceipt transfer(TransferRequest request);
}
