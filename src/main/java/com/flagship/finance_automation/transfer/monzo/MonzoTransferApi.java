package com.flagship.finance_automation.transfer.monzo;

import com.flagship.finance_automation.bank.AccessTokenProvider;
import com.flagship.finance_automation.config.FinanceProperties;
import com.flagship.finance_automation.transfer.AmbiguousTransferException;
import com.flagship.finance_automation.transfer.TransferApi;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferReceipt;
import com.flagship.finance_automation.transfer.TransferRejectedException;
import com.flagship.finance_automation.transfer.TransferRequest;
import com.flagship.finance_automation.transfer.TransientTransferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;

/**
 * Moves money between the funding account and pots through the Monzo pots API.
 *
 * Deposit:  PUT /pots/{pot}/deposit  source_account_id, amount, dedupe_id
 * Withdraw: PUT /pots/{pot}/withdraw destination_account_id, amount, dedupe_id
 *
 * The ledger key is sent as {@code dedupe_id}, so Monzo ignores a repeat of a
 * call it already processed.
 *
 * Failure classification:
 * - 400, 401, 403, 404, 422 and other 4xx: rejected
 * - 408, 5xx, read timeouts, other I/O: ambiguous
 * - 429, connection refused, unknown host: not processed
 */
@Component
@Slf4j
public class MonzoTransferApi implements TransferApi {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final AccessTokenProvider tokens;

    @Autowired
    public MonzoTransferApi(@Qualifier("monzoRestTemplate") RestTemplate restTemplate,
                            FinanceProperties properties,
                            AccessTokenProvider tokens) {
        this(restTemplate, properties.getMonzo().getBaseUrl(), tokens);
    }

    public MonzoTransferApi(RestTemplate restTemplate, String baseUrl, AccessTokenProvider tokens) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.tokens = tokens;
    }

    @Override
    public TransferReceipt transfer(TransferRequest request) {
        TransferEndpoint source = request.getSource();
        TransferEndpoint destination = request.getDestination();

        String potId;
        String operation;
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (!source.isPot() && destination.isPot()) {
            potId = destination.getId();
            operation = "deposit";
            form.add("source_account_id", source.getId());
        } else if (source.isPot() && !destination.isPot()) {
            potId = source.getId();
            operation = "withdraw";
            form.add("destination_account_id", destination.getId());
        } else {
            throw new TransferRejectedException(
                    String.format("Unsupported route %s -> %s", source, destination));
        }
        form.add("amount", String.valueOf(request.getAmountMinorUnits()));
        form.add("dedupe_id", request.getClientIdempotencyKey());

        String token = tokens.transferToken()
                .orElseThrow(() -> new TransferRejectedException("No Monzo access token configured"));

        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/pots/{pot}/{operation}")
                .buildAndExpand(potId, operation)
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(token);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<MonzoPotResponse> response = restTemplate.exchange(
                    uri, HttpMethod.PUT, new HttpEntity<>(form, headers), MonzoPotResponse.class);
            MonzoPotResponse pot = response.getBody();
            log.info("Monzo pot {} succeeded: pot={}, amount={}, dedupeId={}",
                    operation, potId, request.getAmountMinorUnits(), request.getClientIdempotencyKey());
            return new TransferReceipt(request.getClientIdempotencyKey(), pot == null ? null : pot.getBalance());

        } catch (HttpStatusCodeException e) {
            throw classify(e.getStatusCode(), operation, e);

        } catch (ResourceAccessException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
                throw new TransientTransferException("Could not connect to Monzo: " + cause.getMessage(), e);
            }
            throw new AmbiguousTransferException("I/O error during pot " + operation + ": " + e.getMessage(), e);
        }
    }

    private RuntimeException classify(HttpStatusCode status, String operation, HttpStatusCodeException e) {
        int code = status.value();
        String detail = String.format("pot %s returned HTTP %d: %s", operation, code, e.getResponseBodyAsString());
        if (code == 429) {
            return new TransientTransferException(detail, e);
        }
        if (code == 408 || status.is5xxServerError()) {
            return new AmbiguousTransferException(detail, e);
        }
        return new TransferRejectedException(detail, e);
    }
}
