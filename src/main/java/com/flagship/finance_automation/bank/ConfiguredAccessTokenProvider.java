package com.flagship.finance_automation.bank;

import com.flagship.finance_automation.config.FinanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Reads tokens from {@code finance.banks.<bank>.access-token} and
 * {@code finance.monzo.access-token}, normally populated from environment variables.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredAccessTokenProvider implements AccessTokenProvider {

    private final FinanceProperties properties;

    @Override
    public Optional<String> aggregationToken(BankRef bankRef) {
        for (Map.Entry<String, FinanceProperties.Bank> entry : properties.getBanks().entrySet()) {
            if (BankRef.fromConfigKey(entry.getKey()) == bankRef) {
                return nonBlank(entry.getValue().getAccessToken());
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> transferToken() {
        return nonBlank(properties.getMonzo().getAccessToken());
    }

    private static Optional<String> nonBlank(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
