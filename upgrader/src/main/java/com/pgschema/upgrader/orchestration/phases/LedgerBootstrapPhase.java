package com.pgschema.upgrader.orchestration.phases;

import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.orchestration.UpgradeContext;
import com.pgschema.upgrader.orchestration.UpgradePhase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Phase for creating the ledger table if it does not exist yet.
 */
@Component
@RequiredArgsConstructor
public class LedgerBootstrapPhase implements UpgradePhase {

    private final LedgerAccessor ledgerAccessor;

    @Override
    public Mono<Void> execute(UpgradeContext context) {
        return ledgerAccessor.bootstrap(context.getSession(), context.getOptions());
    }

    @Override
    public String getPhaseName() {
        return "Ledger Bootstrap";
    }
}
