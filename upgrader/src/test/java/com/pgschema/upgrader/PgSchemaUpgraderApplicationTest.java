package com.pgschema.upgrader;

import com.pgschema.upgrader.config.StrategyType;
import com.pgschema.upgrader.config.UpgraderProperties;
import com.pgschema.upgrader.ledger.LedgerAccessor;
import com.pgschema.upgrader.orchestration.UpgradeOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "upgrader.lock-key=7",
    "upgrader.connect-timeout=3s"
})
@DisplayName("Application context")
class PgSchemaUpgraderApplicationTest {

    @Autowired
    private SchemaUpgrader schemaUpgrader;

    @Autowired
    private UpgradeOrchestrator orchestrator;

    @Autowired
    private LedgerAccessor ledgerAccessor;

    @Autowired
    private UpgraderProperties properties;

    @Test
    @DisplayName("wires the engine from configuration")
    void wiresEngine() {
        assertThat(schemaUpgrader).isNotNull();
        assertThat(orchestrator).isNotNull();
        assertThat(ledgerAccessor.getLockKey()).isEqualTo(7L);
        assertThat(properties.getConnectTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(properties.getStrategy()).isEqualTo(StrategyType.REACTIVE);
        assertThat(properties.getConnection().getPort()).isEqualTo(5432);
    }
}
