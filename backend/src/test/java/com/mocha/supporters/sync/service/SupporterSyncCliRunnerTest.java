package com.mocha.supporters.sync.service;

import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.ledger.LedgerTransportException;
import com.mocha.supporters.sync.model.SupporterDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SupporterSyncCliRunnerTest {
    @Mock
    private SupporterSyncService syncService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    @Test
    void doesNothingUnlessEnabled() throws Exception {
        SupportersProperties properties = new SupportersProperties();

        new SupporterSyncCliRunner(properties, syncService, applicationContext)
            .run(new DefaultApplicationArguments());

        verifyNoInteractions(syncService);
    }

    @Test
    void runsConfiguredSlugWhenEnabled() throws Exception {
        SupportersProperties properties = cliProperties();
        when(syncService.sync("webpack")).thenReturn(new SupporterDataset(List.of(), List.of(), Instant.now()));

        new SupporterSyncCliRunner(properties, syncService, applicationContext)
            .run(new DefaultApplicationArguments());

        verify(syncService).sync("webpack");
    }

    @Test
    void failureIsRethrownWhenProcessStaysUp() {
        SupportersProperties properties = cliProperties();
        when(syncService.sync("webpack")).thenThrow(new LedgerTransportException("ledger down"));

        assertThatThrownBy(() -> new SupporterSyncCliRunner(properties, syncService, applicationContext)
            .run(new DefaultApplicationArguments()))
            .isInstanceOf(LedgerTransportException.class)
            .hasMessage("ledger down");
    }

    private SupportersProperties cliProperties() {
        SupportersProperties properties = new SupportersProperties();
        properties.getCli().setRun(true);
        properties.getCli().setSlug("webpack");
        properties.getCli().setExitAfterRun(false);
        return properties;
    }
}
