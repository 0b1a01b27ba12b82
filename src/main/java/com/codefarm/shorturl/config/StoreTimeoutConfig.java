package com.codefarm.shorturl.config;

import org.hibernate.jpa.SpecHints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.autoconfigure.transaction.TransactionManagerCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;

import java.time.Duration;

/**
 * Bounds every store call by {@code shorturl.store.timeout}: transactions get it as their
 * default timeout and each JPA query as its query timeout. A call that runs over fails
 * with a {@code DataAccessException}.
 */
@Configuration
@EnableConfigurationProperties(ShortUrlProperties.class)
public class StoreTimeoutConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreTimeoutConfig.class);

    @Bean
    public TransactionManagerCustomizer<AbstractPlatformTransactionManager> storeTransactionTimeout(
            ShortUrlProperties properties) {
        int seconds = transactionTimeoutSeconds(properties.store().timeout());
        return transactionManager -> {
            transactionManager.setDefaultTimeout(seconds);
            log.info("Store transaction timeout set to {}s", seconds);
        };
    }

    @Bean
    public HibernatePropertiesCustomizer storeQueryTimeout(ShortUrlProperties properties) {
        int millis = Math.toIntExact(properties.store().timeout().toMillis());
        return hibernateProperties -> hibernateProperties.put(SpecHints.HINT_SPEC_QUERY_TIMEOUT, millis);
    }

    /**
     * Transaction timeouts have whole second resolution; anything shorter rounds up to one second.
     */
    static int transactionTimeoutSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
