package com.notifica.emisor.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clears failed entries from the migration history before migrating, so a half-applied
 * script from an earlier deploy does not block startup.
 */
@Configuration
public class FlywayRepairConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayRepairConfig.class);

    @Value("${emisor.flyway.repair-on-start:true}")
    private boolean repairOnStart;

    @Bean
    public FlywayMigrationStrategy emisorMigrationStrategy() {
        return this::repairThenMigrate;
    }

    void repairThenMigrate(Flyway flyway) {
        if (repairOnStart) {
            attemptRepair(flyway);
        }
        MigrateResult result = flyway.migrate();
        log.info("[Schema][Migrate] executed={} version={}", result.migrationsExecuted, result.targetSchemaVersion);
    }

    private static void attemptRepair(Flyway flyway) {
        try {
            flyway.repair();
            log.info("[Schema][Repair] history repaired");
        } catch (RuntimeException e) {
            // A repair failure is not fatal; migrate reports the real problem if there is one.
            log.warn("[Schema][Repair] not applied: {}", e.getMessage());
        }
    }
}
