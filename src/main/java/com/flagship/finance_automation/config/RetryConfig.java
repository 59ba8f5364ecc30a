package com.flagship.finance_automation.config;

import com.flagship.finance_automation.bank.TransientAccountSourceException;
import com.flagship.finance_automation.transfer.TransientTransferException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Bounded exponential backoff policies for outbound calls.
 *
 * Only the transient exception types are retried; everything else surfaces on
 * the first attempt.
 */
@Configuration
public class RetryConfig {

    /**
     * Used by MoneyMover around every transfer API call.
     */
    @Bean
    public RetryTemplate transferRetryTemplate(FinanceConfiguration configuration) {
        FinanceConfiguration.TransferPolicy policy = configuration.getTransfers();
        return RetryTemplate.builder()
                .maxAttempts(policy.getMaxAttempts())
                .exponentialBackoff(policy.getInitialBackoff().toMillis(), policy.getMultiplier(),
                        policy.getMaxBackoff().toMillis())
                .retryOn(TransientTransferException.class)
                .build();
    }

    /**
     * Used by the aggregation API client for rate-limited and unavailable fetches.
     */
    @Bean
    public RetryTemplate balanceFetchRetryTemplate(FinanceProperties properties) {
        FinanceProperties.TrueLayer trueLayer = properties.getTruelayer();
        long initial = Math.max(1, trueLayer.getInitialBackoff().toMillis());
        return RetryTemplate.builder()
                .maxAttempts(trueLayer.getMaxAttempts())
                .exponentialBackoff(initial, 2.0, initial * 8)
                .retryOn(TransientAccountSourceException.class)
                .build();
    }
}
