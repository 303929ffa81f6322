package com.pgschema.upgrader.orchestration.phases;

import com.pgschema.upgrader.integrity.IntegrityValidator;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.orchestration.UpgradeContext;
import com.pgschema.upgrader.orchestration.UpgradePhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Phase that reads the ledger and reconciles it with the steps on disk.
 * Completes before any step SQL runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IntegrityValidationPhase implements UpgradePhase {

    private final LedgerAccessor ledgerAccessor;
    private final IntegrityValidator integrityValidator;

    @Override
    public Mono<Void> execute(UpgradeContext context) {
        return ledgerAccessor.readHistory(context.getSession(), context.getOptions())
            .doOnNext(history -> {
                context.setHistory(history);
                context.setPendingSteps(integrityValidator.validate(context.getSteps(), history));

                log.info("[Run-{}] Ledger holds {} applied steps, {} pending",
                    context.getRunId(), history.size(), context.getPendingSteps().size());
            })
            .then();
    }

    @Override
    public String getPhaseName() {
        return "Integrity Validation";
    }
}
