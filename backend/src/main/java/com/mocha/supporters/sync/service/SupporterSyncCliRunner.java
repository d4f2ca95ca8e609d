package com.mocha.supporters.sync.service;

import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.model.SupporterDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class SupporterSyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SupporterSyncCliRunner.class);

    private final SupportersProperties properties;
    private final SupporterSyncService syncService;
    private final ConfigurableApplicationContext applicationContext;

    public SupporterSyncCliRunner(
        SupportersProperties properties,
        SupporterSyncService syncService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.syncService = syncService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = 0;
        try {
            SupporterDataset dataset = syncService.sync(properties.getCli().getSlug());
            log.info(
                "Supporter sync completed: sponsors={}, backers={}",
                dataset.sponsors().size(),
                dataset.backers().size()
            );
        } catch (RuntimeException e) {
            if (!properties.getCli().isExitAfterRun()) {
                throw e;
            }
            log.error("Supporter sync failed: {}", e.getMessage());
            exitCode = 1;
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }
}
