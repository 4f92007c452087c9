package com.notifica.emisor.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Startup guards for the emission backend.
 * <p>
 * Padron tables are created at runtime next to the Flyway-managed tables, so Hibernate must never
 * be allowed to rebuild the schema outside a test profile. The PDF output root is created here
 * so the first run does not fail on a missing directory.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private static final Set<String> SCHEMA_REWRITING_MODES = Set.of("create", "create-drop", "update");

    private final Environment environment;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void checkOnStartup() {
        String ddlMode = environment.getProperty("spring.jpa.hibernate.ddl-auto", "validate");
        String url = environment.getProperty("spring.datasource.url", "");
        Path outputRoot = Path.of(environment.getProperty("emisor.output.root", "./output"));
        boolean testProfile = Arrays.stream(environment.getActiveProfiles())
                .anyMatch(p -> p.toLowerCase(Locale.ROOT).contains("test"));

        log.info("[Startup][Guard] profiles={} ddlAuto={} url={} outputRoot={}",
                Arrays.toString(environment.getActiveProfiles()), ddlMode, url, outputRoot.toAbsolutePath());

        guardSchemaMode(ddlMode, testProfile);
        if (url.toLowerCase(Locale.ROOT).contains(":mem:")) {
            log.warn("[Startup][Guard] in-memory datasource; padron rows and the emission audit trail are lost on restart");
        }
        prepareOutputRoot(outputRoot);
    }

    static void guardSchemaMode(String ddlMode, boolean testProfile) {
        String mode = ddlMode == null ? "" : ddlMode.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (SCHEMA_REWRITING_MODES.contains(mode) && !testProfile) {
            throw new IllegalStateException("spring.jpa.hibernate.ddl-auto=" + ddlMode
                    + " would rewrite padron and audit tables; schema changes go through Flyway migrations");
        }
    }

    static void prepareOutputRoot(Path root) {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("Output root cannot be created: " + root.toAbsolutePath(), e);
        }
        if (!Files.isWritable(root)) {
            throw new IllegalStateException("Output root is not writable: " + root.toAbsolutePath());
        }
    }
}
