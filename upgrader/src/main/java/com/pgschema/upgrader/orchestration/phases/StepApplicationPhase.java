package com.pgschema.upgrader.orchestration.phases;

import com.pgschema.upgrader.executor.StepApplier;
import com.pgschema.upgrader.orchestration.UpgradeContext;
import com.pgschema.upgrader.orchestration.UpgradePhase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Phase for applying pending steps, one transaction each, strictly in order.
 * The first failing step ends the run; earlier commits stay.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StepApplicationPhase implements UpgradePhase {

    private final StepApplier stepApplier;

    @Override
    public Mono<Void> execute(UpgradeContext context) {
        return Flux.fromIterable(context.getPendingSteps())
            .concatMap(step -> stepApplier.apply(context.getSession(), step, context.getOptions()))
            .doOnNext(key -> {
                context.markApplied(key);
                log.info("[Run-{}] ✓ Step {} committed", context.getRunId(), key);
            })
            .then();
    }

    @Override
    public String getPhaseName() {
        return "Step Application";
    }

    @Override
    public boolean shouldSkip(UpgradeContext context) {
        return context.getPendingSteps().isEmpty();
    }
}
