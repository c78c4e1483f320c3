package com.backmeup.credentials.config;

import com.backmeup.credentials.model.InitializationReport;
import com.backmeup.credentials.service.CredentialsStoreInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the store initialization once the context is ready.
 * A failure here fails application startup, so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(prefix = "backmeup.store", name = "initialize-on-startup", havingValue = "true", matchIfMissing = true)
public class InitializeOnStartupRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(InitializeOnStartupRunner.class);

    private final CredentialsStoreInitializer initializer;

    public InitializeOnStartupRunner(CredentialsStoreInitializer initializer) {
        this.initializer = initializer;
    }

    @Override
    public void run(ApplicationArguments args) {
        InitializationReport report = initializer.initialize();
        if (report.changed()) {
            log.info("Credentials store {} initialized: migrations={}, schemaVersion={}, seedInserted={}",
                report.namespace(), report.appliedMigrations(), report.schemaVersion(), report.seedInserted());
        } else {
            log.info("Credentials store {} already up to date (schemaVersion={})",
                report.namespace(), report.schemaVersion());
        }
    }
}
