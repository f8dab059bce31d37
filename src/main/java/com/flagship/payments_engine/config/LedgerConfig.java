package com.flagship.payments_engine.config;

import com.flagship.payments_engine.ledger.ErrorMode;
import com.flagship.payments_engine.ledger.InMemoryLedgerStore;
import com.flagship.payments_engine.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Ledger wiring.
 *
 * The store is an explicit bean injected wherever it is needed; there is no global instance.
 * {@code engine.error-mode} picks how refused events are handled for the whole run.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Value("${engine.error-mode:permissive}")
    private String errorMode;

    @Bean
    public LedgerStore ledgerStore() {
        ErrorMode mode = ErrorMode.fromProperty(errorMode);
        log.info("Creating in-memory ledger store: errorMode={}", mode);
        return new InMemoryLedgerStore(mode);
    }
}
