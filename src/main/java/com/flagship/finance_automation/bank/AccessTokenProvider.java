package com.flagship.finance_automation.bank;

import java.util.Optional;

/**
 * Supplies bearer tokens obtained by an external credential provider.
 * Tokens are never refreshed here.
 */
public interface AccessTokenProvider {

    Optional<String> aggregationToken(BankRef bankRef);

    Optional<String> transferToken();
}
