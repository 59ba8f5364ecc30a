package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.GroupRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bridges {@link BalanceSnapshot} and its JPA entity. Upserts by (bank, group).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceSnapshotStore {

    private final BalanceSnapshotRepository repository;

    @Transactional(readOnly = true)
    public Optional<BalanceSnapshot> find(GroupRef group) {
        return repository.findById(new BalanceSnapshotId(group.getBankRef().name(), group.getGroupName()))
                .map(BalanceSnapshotEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<BalanceSnapshot> findAll() {
        return repository.findAllOrdered().stream()
                .map(BalanceSnapshotEntity::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countStale() {
        return repository.countByStaleTrue();
    }

    @Transactional
    public BalanceSnapshot save(BalanceSnapshot snapshot) {
        BalanceSnapshotEntity entity = repository.findById(BalanceSnapshotEntity.idOf(snapshot))
                .map(existing -> {
                    existing.updateFromDomain(snapshot);
                    return existing;
                })
                .orElseGet(() -> BalanceSnapshotEntity.fromDomain(snapshot));
        BalanceSnapshotEntity saved = repository.save(entity);
        log.debug("Saved snapshot {}/{}: amount={}, stale={}", snapshot.getBankRef(), snapshot.getGroupName(),
                snapshot.getAmountMinorUnits(), snapshot.isStale());
        return saved.toDomain();
    }
}
