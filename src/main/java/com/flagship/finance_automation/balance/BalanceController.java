package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.BankRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/balances")
@RequiredArgsConstructor
@Slf4j
public class BalanceController {

    private final BalanceSnapshotStore store;
    private final BalancePollService pollService;

    @GetMapping
    public List<BalanceSnapshotResponse> listBalances() {
        return store.findAll().stream()
                .map(BalanceSnapshotResponse::fromSnapshot)
                .collect(Collectors.toList());
    }

    /**
     * Polls a bank immediately. 409 when a poll of the bank is already running.
     */
    @PostMapping("/{bank}/poll")
    public ResponseEntity<List<BalanceSnapshotResponse>> poll(@PathVariable("bank") String bank) {
        BankRef bankRef = BankRef.fromConfigKey(bank);
        log.info("On-demand poll requested: bank={}", bankRef);
        List<BalanceSnapshotResponse> snapshots = pollService.pollNow(bankRef)
                .orElseThrow(() -> new IllegalStateException("A poll of " + bankRef + " is already in progress"))
                .values().stream()
                .map(BalanceSnapshotResponse::fromSnapshot)
                .collect(Collectors.toList());
        return ResponseEntity.ok(snapshots);
    }
}
