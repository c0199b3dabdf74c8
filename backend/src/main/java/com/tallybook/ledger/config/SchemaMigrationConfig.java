package com.tallybook.ledger.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SchemaMigrationConfig {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrationConfig.class);

    // Repair clears failed entries from the history table left by an interrupted deploy
    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy(@Value("${tallybook.flyway.repair-on-start:false}") boolean repairOnStart) {
        return flyway -> migrate(flyway, repairOnStart);
    }

    static void migrate(Flyway flyway, boolean repairOnStart) {
        if (repairOnStart) {
            try {
                log.info("[Schema][Repair] running Flyway repair before migrate");
                flyway.repair();
            } catch (Exception ex) {
                log.warn("[Schema][Repair] Flyway repair failed or not needed: {}", ex.getMessage());
            }
        }
        flyway.migrate();
    }
}
