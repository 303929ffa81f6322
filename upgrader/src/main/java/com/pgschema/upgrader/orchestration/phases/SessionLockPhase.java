package com.pgschema.upgrader.orchestration.phases;

import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.orchestration.UpgradeContext;
import com.pgschema.upgrader.orchestration.UpgradePhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Phase that takes the advisory lock so concurrent runs against one database serialize.
 * The lock is held until the session is released.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SessionLockPhase implements UpgradePhase {

    private final LedgerAccessor ledgerAccessor;

    @Override
    public Mono<Void> execute(UpgradeContext context) {
        return Mono.defer(() -> {
            log.info("[Run-{}] Waiting for upgrade lock {}...", context.getRunId(), ledgerAccessor.getLockKey());
            return ledgerAccessor.acquireLock(context.getSession());
        }).doOnSuccess(v -> {
            context.setLockAcquired(true);
            log.info("[Run-{}] ✓ Upgrade lock acquired", context.getRunId());
        });
    }

    @Override
    public String getPhaseName() {
        return "Session Lock";
    }
}
