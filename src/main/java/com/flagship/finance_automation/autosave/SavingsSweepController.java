package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.transfer.dto.TransferRecordResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pending savings and on-demand sweeps.
 */
@RestController
@RequestMapping("/api/savings")
@RequiredArgsConstructor
@Slf4j
public class SavingsSweepController {

    private final SavingsSweepService sweepService;

    @GetMapping("/calculation")
    public ResponseEntity<SavingsCalculationResponse> calculation() {
        return ResponseEntity.ok(SavingsCalculationResponse.from(sweepService.calculate()));
    }

    /**
     * @return the deposit's ledger record, or 204 when there was nothing to save
     */
    @PostMapping("/sweep")
    public ResponseEntity<TransferRecordResponse> sweep() {
        log.info("Savings sweep requested");
        return sweepService.sweep()
                .map(record -> ResponseEntity.ok(TransferRecordResponse.from(record)))
                .orElse(ResponseEntity.noContent().build());
    }
}
