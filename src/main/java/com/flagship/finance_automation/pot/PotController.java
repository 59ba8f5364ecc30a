package com.flagship.finance_automation.pot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pots")
@RequiredArgsConstructor
@Slf4j
public class PotController {

    private final PotReconciliationService reconciliationService;

    /**
     * Runs one reconciliation now. {@code confirmed=true} approves a top-up above
     * the pot's automatic limit.
     */
    @PostMapping("/{name}/reconcile")
    public ResponseEntity<ReconciliationResponse> reconcile(
            @PathVariable("name") String name,
            @RequestParam(name = "confirmed", defaultValue = "false") boolean confirmed) {
        log.info("Reconciliation requested: pot={}, confirmed={}", name, confirmed);
        ReconciliationResult result = reconciliationService.reconcile(name, confirmed);
        return ResponseEntity.ok(ReconciliationResponse.from(result));
    }
}
