package com.bank.ledger.infrastructure.file;

import com.bank.ledger.domain.event.TradeChronology;
import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.source.TradeSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Trade history exported to a JSON file.
 * Accepts either an array of trade records or a saved TradesHistory response
 * ({"result":{"trades":{txid:{...}}}}).
 */
public class JsonFileTradeSource implements TradeSource {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTradeSource.class);

    private final ObjectMapper objectMapper;
    private final Path path;

    public JsonFileTradeSource(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
    }

    @Override
    public List<TradeEvent> fetchTrades() {
        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read trades from " + path, e);
        }

        List<TradeEvent> trades = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                trades.add(read(node, null));
            }
        } else {
            JsonNode byId = root.path("result").path("trades");
            Iterator<Map.Entry<String, JsonNode>> fields = byId.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                trades.add(read(entry.getValue(), entry.getKey()));
            }
        }
        log.info("Loaded {} trades from {}", trades.size(), path);
        return TradeChronology.oldestFirst(trades);
    }

    private TradeEvent read(JsonNode node, String tradeId) {
        TradeEvent event;
        try {
            event = objectMapper.treeToValue(node, TradeEvent.class);
        } catch (IOException e) {
            log.warn("Unreadable trade record in {}: {}", path, e.getMessage());
            event = new TradeEvent();
        }
        if (tradeId != null) {
            event.setTradeId(tradeId);
        }
        return event;
    }
}
