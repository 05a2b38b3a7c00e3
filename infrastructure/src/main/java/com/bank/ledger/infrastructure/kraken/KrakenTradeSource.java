package com.bank.ledger.infrastructure.kraken;

import com.bank.ledger.domain.event.TradeChronology;
import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.source.TradeSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the account's full trade history from Kraken's private TradesHistory endpoint.
 * Kraken pages with an offset ("ofs") and returns newest trades first; the result is
 * returned oldest first.
 */
public class KrakenTradeSource implements TradeSource {

    private static final Logger log = LoggerFactory.getLogger(KrakenTradeSource.class);

    private final KrakenApiClient client;
    private final ObjectMapper objectMapper;
    private final Duration pageDelay;

    public KrakenTradeSource(KrakenApiClient client, ObjectMapper objectMapper, Duration pageDelay) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.pageDelay = pageDelay;
    }

    @Override
    public List<TradeEvent> fetchTrades() {
        List<TradeEvent> trades = new ArrayList<>();
        int offset = 0;
        while (true) {
            JsonNode response = client.queryPrivate("TradesHistory", Map.of("ofs", String.valueOf(offset)));
            List<String> errors = KrakenApiClient.errors(response);
            if (!errors.isEmpty()) {
                throw new KrakenApiException("TradesHistory error: " + errors);
            }

            JsonNode result = response.path("result");
            List<TradeEvent> page = readPage(result.path("trades"));
            trades.addAll(page);
            int count = result.path("count").asInt(0);
            offset += page.size();
            log.debug("Fetched TradesHistory page of {} trades ({} of {})", page.size(), offset, count);

            if (offset >= count || page.isEmpty()) {
                break;
            }
            pause();
        }
        log.info("Fetched {} trades from Kraken", trades.size());
        return TradeChronology.oldestFirst(trades);
    }

    private List<TradeEvent> readPage(JsonNode tradesById) {
        List<TradeEvent> page = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tradesById.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            try {
                TradeEvent event = objectMapper.treeToValue(entry.getValue(), TradeEvent.class);
                event.setTradeId(entry.getKey());
                page.add(event);
            } catch (JsonProcessingException e) {
                // Kept as an empty record so the ledger book reports it as skipped
                log.warn("Unreadable trade {}: {}", entry.getKey(), e.getOriginalMessage());
                page.add(TradeEvent.builder().tradeId(entry.getKey()).build());
            }
        }
        return page;
    }

    private void pause() {
        if (pageDelay.isZero() || pageDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(pageDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KrakenApiException("Interrupted while paging trade history", e);
        }
    }
}
