package com.flagship.finance_automation.transfer;

import com.flagship.finance_automation.transfer.dto.ResolutionRequest;
import com.flagship.finance_automation.transfer.dto.TransferRecordResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read access to the transfer ledger and the manual reconciliation path for
 * abandoned transfers.
 */
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private final TransferLedger ledger;

    @GetMapping("/{key}")
    public ResponseEntity<TransferRecordResponse> getTransfer(@PathVariable("key") String key) {
        TransferRecord record = ledger.find(key).orElseThrow(() -> UnknownRecordException.notFound(key));
        return ResponseEntity.ok(TransferRecordResponse.from(record));
    }

    /**
     * Lists records in one status, oldest update first. {@code ?status=ABANDONED}
     * is the queue of transfers waiting for a human.
     */
    @GetMapping
    public List<TransferRecordResponse> listTransfers(
            @RequestParam(name = "status", defaultValue = "ABANDONED") TransferStatus status) {
        return ledger.findByStatus(status).stream()
                .map(TransferRecordResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Resolves an ABANDONED record once the operator has checked the provider.
     * 404 when the record is missing or not ABANDONED.
     */
    @PostMapping("/{key}/resolution")
    public ResponseEntity<TransferRecordResponse> resolve(@PathVariable("key") String key,
                                                          @Valid @RequestBody ResolutionRequest request) {
        TransferStatus outcome = TransferStatus.valueOf(request.getOutcome());
        log.info("Manual resolution requested: key={}, outcome={}", key, outcome);
        TransferRecord resolved = ledger.resolveAbandoned(key, outcome, request.getNote());
        return ResponseEntity.ok(TransferRecordResponse.from(resolved));
    }
}
