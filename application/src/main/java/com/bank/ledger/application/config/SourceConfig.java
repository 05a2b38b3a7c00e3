package com.bank.ledger.application.config;

import com.bank.ledger.domain.source.PriceSource;
import com.bank.ledger.domain.source.TradeSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Source configuration
 * Wires the trade and price sources based on application.yml configuration
 *
 * Configuration in application.yml:
 *   app:
 *     source:
 *       type: file  # or kraken
 *       file:
 *         trades: trades.json
 *         prices: prices.json
 *
 * Or use environment variables:
 *   APP_SOURCE_TYPE=kraken
 */
@Configuration
public class SourceConfig {

    private static final String KRAKEN = "kraken";
    private static final String FILE = "file";

    @Value("${app.source.type:file}")
    private String sourceType;

    @Autowired
    private ApplicationContext applicationContext;

    /**
     * Primary TradeSource bean
     * Selected based on app.source.type property
     */
    @Bean
    @Primary
    public TradeSource tradeSource(@Qualifier("fileTradeSource") TradeSource fileTradeSource) {
        return select(fileTradeSource, "krakenTradeSource", TradeSource.class);
    }

    /**
     * Primary PriceSource bean
     * Selected based on app.source.type property
     */
    @Bean
    @Primary
    public PriceSource priceSource(@Qualifier("filePriceSource") PriceSource filePriceSource) {
        return select(filePriceSource, "krakenPriceSource", PriceSource.class);
    }

    private <T> T select(T fileSource, String krakenBeanName, Class<T> type) {
        String selected = sourceType.trim().toLowerCase();
        if (KRAKEN.equals(selected)) {
            return applicationContext.getBean(krakenBeanName, type);
        }
        if (FILE.equals(selected)) {
            return fileSource;
        }
        throw new IllegalStateException("Unsupported app.source.type: " + sourceType
                + " (expected " + FILE + " or " + KRAKEN + ")");
    }
}
