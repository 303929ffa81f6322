package com.pgschema.upgrader.orchestration.phases;

import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.orchestration.UpgradeContext;
import com.pgschema.upgrader.orchestration.UpgradePhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Phase for creating (when allowed) and activating the target schema.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaPreparationPhase implements UpgradePhase {

    private final LedgerAccessor ledgerAccessor;

    @Override
    public Mono<Void> execute(UpgradeContext context) {
        String schema = context.getOptions().getSchema();
        log.info("[Run-{}] Preparing schema '{}' (create if missing: {})",
            context.getRunId(), schema, context.getOptions().isCreateSchema());

        return ledgerAccessor.prepareSchema(context.getSession(), context.getOptions())
            .doOnSuccess(v -> log.info("[Run-{}] Search path set to '{}'", context.getRunId(), schema));
    }

    @Override
    public String getPhaseName() {
        return "Schema Preparation";
    }

    @Override
    public boolean shouldSkip(UpgradeContext context) {
        // No schema configured: keep the connection's default search path
        return context.getOptions().getSchema() == null;
    }
}
