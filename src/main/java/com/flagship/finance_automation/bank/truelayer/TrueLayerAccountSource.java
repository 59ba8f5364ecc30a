package com.flagship.finance_automation.bank.truelayer;

import com.flagship.finance_automation.bank.AccessTokenProvider;
import com.flagship.finance_automation.bank.AccountBalance;
import com.flagship.finance_automation.bank.AccountIdentifier;
import com.flagship.finance_automation.bank.AccountSource;
import com.flagship.finance_automation.bank.AccountSourceException;
import com.flagship.finance_automation.bank.AccountTransaction;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.FailureKind;
import com.flagship.finance_automation.common.MinorUnits;
import com.flagship.finance_automation.config.FinanceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Balance and transaction source backed by the TrueLayer Data API.
 *
 * Rate-limited and unavailable fetches are retried here with backoff; callers
 * only see a failure once retries are exhausted or the failure is permanent.
 */
@Component
@Slf4j
public class TrueLayerAccountSource implements AccountSource {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final AccessTokenProvider tokens;
    private final RetryTemplate retryTemplate;

    @Autowired
    public TrueLayerAccountSource(@Qualifier("trueLayerRestTemplate") RestTemplate restTemplate,
                                  FinanceProperties properties,
                                  AccessTokenProvider tokens,
                                  @Qualifier("balanceFetchRetryTemplate") RetryTemplate retryTemplate) {
        this(restTemplate, properties.getTruelayer().getBaseUrl(), tokens, retryTemplate);
    }

    public TrueLayerAccountSource(RestTemplate restTemplate, String baseUrl, AccessTokenProvider tokens,
                                  RetryTemplate retryTemplate) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.tokens = tokens;
        this.retryTemplate = retryTemplate;
    }

    @Override
    public AccountBalance fetchBalance(BankRef bankRef, AccountIdentifier identifier) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.info("Retrying balance fetch: bank={}, member={}, attempt={}",
                        bankRef, identifier, context.getRetryCount() + 1);
            }
            return fetchOnce(bankRef, identifier);
        });
    }

    @Override
    public List<AccountTransaction> fetchTransactions(BankRef bankRef, AccountIdentifier identifier,
                                                      Instant from, Instant to) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/data/v1/{collection}/{id}/transactions")
                .queryParam("from", from.toString())
                .queryParam("to", to.toString())
                .buildAndExpand(collection(identifier), identifier.getExternalId())
                .encode()
                .toUri();
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.info("Retrying transaction fetch: bank={}, member={}, attempt={}",
                        bankRef, identifier, context.getRetryCount() + 1);
            }
            TrueLayerTransactionsResponse body = get(bankRef, identifier, uri, TrueLayerTransactionsResponse.class);
            return toTransactions(bankRef, identifier, body, from, to);
        });
    }

    private AccountBalance fetchOnce(BankRef bankRef, AccountIdentifier identifier) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/data/v1/{collection}/{id}/balance")
                .buildAndExpand(collection(identifier), identifier.getExternalId())
                .encode()
                .toUri();
        return toBalance(bankRef, identifier, get(bankRef, identifier, uri, TrueLayerBalanceResponse.class));
    }

    private <T> T get(BankRef bankRef, AccountIdentifier identifier, URI uri, Class<T> responseType) {
        String token = tokens.aggregationToken(bankRef)
                .orElseThrow(() -> AccountSourceException.of(FailureKind.UNAUTHORIZED, bankRef, identifier,
                        "no access token configured", null));

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<T> response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers),
                    responseType);
            return response.getBody();
        } catch (HttpStatusCodeException e) {
            throw AccountSourceException.of(classify(e.getStatusCode()), bankRef, identifier,
                    "HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier, e.getMessage(), e);
        } catch (RestClientException e) {
            throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier,
                    "unreadable response: " + e.getMessage(), e);
        }
    }

    private AccountBalance toBalance(BankRef bankRef, AccountIdentifier identifier, TrueLayerBalanceResponse body) {
        if (body == null || body.getResults() == null || body.getResults().isEmpty()) {
            throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier, "empty balance response", null);
        }
        TrueLayerBalanceResponse.Result result = body.getResults().get(0);
        if (result.getCurrency() == null || result.getCurrency().isBlank()
                || result.getCurrent() == null || result.getUpdateTimestamp() == null) {
            throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier,
                    "balance response without currency, amount or timestamp", null);
        }
        try {
            long minorUnits = MinorUnits.fromMajor(result.getCurrent());
            Instant asOf = OffsetDateTime.parse(result.getUpdateTimestamp()).toInstant();
            return new AccountBalance(minorUnits, result.getCurrency().trim(), asOf);
        } catch (ArithmeticException | DateTimeParseException e) {
            throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier,
                    "malformed balance: " + e.getMessage(), e);
        }
    }

    private List<AccountTransaction> toTransactions(BankRef bankRef, AccountIdentifier identifier,
                                                    TrueLayerTransactionsResponse body, Instant from, Instant to) {
        if (body == null || body.getResults() == null) {
            throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier,
                    "empty transactions response", null);
        }
        List<AccountTransaction> transactions = new ArrayList<>();
        for (TrueLayerTransactionsResponse.Result result : body.getResults()) {
            if (result.getAmount() == null || result.getTimestamp() == null) {
                log.warn("Skipping transaction {} of {} without amount or timestamp",
                        result.getTransactionId(), identifier);
                continue;
            }
            try {
                Instant timestamp = OffsetDateTime.parse(result.getTimestamp()).toInstant();
                if (timestamp.isBefore(from) || !timestamp.isBefore(to)) {
                    continue;
                }
                transactions.add(new AccountTransaction(
                        result.getTransactionId(),
                        timestamp,
                        result.getDescription() == null ? "" : result.getDescription().trim(),
                        Math.abs(MinorUnits.fromMajor(result.getAmount())),
                        result.getCurrency(),
                        direction(result)));
            } catch (ArithmeticException | DateTimeParseException e) {
                throw AccountSourceException.of(FailureKind.UNAVAILABLE, bankRef, identifier,
                        "malformed transaction " + result.getTransactionId() + ": " + e.getMessage(), e);
            }
        }
        return transactions;
    }

    private static AccountTransaction.Direction direction(TrueLayerTransactionsResponse.Result result) {
        if ("CREDIT".equalsIgnoreCase(result.getTransactionType())) {
            return AccountTransaction.Direction.CREDIT;
        }
        if ("DEBIT".equalsIgnoreCase(result.getTransactionType())) {
            return AccountTransaction.Direction.DEBIT;
        }
        return result.getAmount().signum() < 0
                ? AccountTransaction.Direction.DEBIT
                : AccountTransaction.Direction.CREDIT;
    }

    private static String collection(AccountIdentifier identifier) {
        return identifier.getKind() == AccountIdentifier.Kind.CARD ? "cards" : "accounts";
    }

    private static FailureKind classify(HttpStatusCode status) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return FailureKind.UNAUTHORIZED;
        }
        if (code == 404) {
            return FailureKind.NOT_FOUND;
        }
        if (code == 429) {
            return FailureKind.RATE_LIMITED;
        }
        return FailureKind.UNAVAILABLE;
    }
}
