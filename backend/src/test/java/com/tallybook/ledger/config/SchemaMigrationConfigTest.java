package com.tallybook.ledger.config;

import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class SchemaMigrationConfigTest {

    @Test
    void repairsBeforeMigrateWhenEnabled() {
        Flyway flyway = mock(Flyway.class);

        new SchemaMigrationConfig().flywayMigrationStrategy(true).migrate(flyway);

        var order = inOrder(flyway);
        order.verify(flyway).repair();
        order.verify(flyway).migrate();
    }

    @Test
    void failedRepairStillMigrates() {
        Flyway flyway = mock(Flyway.class);
        when(flyway.repair()).thenThrow(new IllegalStateException("no history table"));

        SchemaMigrationConfig.migrate(flyway, true);

        verify(flyway).migrate();
    }

    @Test
    void plainMigrateByDefault() {
        Flyway flyway = mock(Flyway.class);

        SchemaMigrationConfig.migrate(flyway, false);

        verify(flyway, never()).repair();
        verify(flyway).migrate();
    }
}
