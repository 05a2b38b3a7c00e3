package com.bank.ledger.domain.parse;

import com.bank.ledger.domain.enums.TradeSide;
import com.bank.ledger.domain.event.TradeEvent;
import com.bank.ledger.domain.model.ParsedTrade;
import com.bank.ledger.domain.pair.PairNormalizer;

import java.math.BigDecimal;
import java.util.Optional;

import static com.bank.ledger.domain.util.DecimalUtils.toDecimalOrDefault;

/**
 * Converts raw trade records into {@link ParsedTrade}s without ever throwing.
 * Missing numeric fields default to zero (cost defaults to volume * price); values that
 * are present but not numbers, negative amounts, an empty pair or an unknown side make
 * the record fail.
 */
public class TradeRecordParser {

    private final PairNormalizer pairNormalizer;

    public TradeRecordParser(PairNormalizer pairNormalizer) {
        this.pairNormalizer = pairNormalizer;
    }

    public ParseResult parse(int index, TradeEvent event) {
        if (event == null) {
            return ParseResult.failure("Empty record");
        }
        String pair = event.getPair() == null ? "" : event.getPair().trim();
        if (pair.isEmpty()) {
            return ParseResult.failure("Pair is required");
        }
        Optional<TradeSide> side = TradeSide.fromText(event.getSide());
        if (side.isEmpty()) {
            return ParseResult.failure("Unsupported side: " + event.getSide());
        }

        try {
            BigDecimal volume = decimal("volume", event.getVolume(), BigDecimal.ZERO);
            BigDecimal price = decimal("price", event.getPrice(), BigDecimal.ZERO);
            BigDecimal cost = decimal("cost", event.getCost(), volume.multiply(price));
            BigDecimal fee = decimal("fee", event.getFee(), BigDecimal.ZERO);
            BigDecimal timestamp = decimal("time", event.getTime(), BigDecimal.ZERO);

            if (volume.signum() < 0 || price.signum() < 0 || fee.signum() < 0) {
                return ParseResult.failure("Volume, price and fee cannot be negative");
            }

            return ParseResult.success(ParsedTrade.builder()
                    .index(index)
                    .tradeId(event.getTradeId())
                    .pairIdentifier(pair)
                    .pairKey(pairNormalizer.parse(pair))
                    .side(side.get())
                    .volume(volume)
                    .price(price)
                    .cost(cost)
                    .fee(fee)
                    .timestamp(timestamp)
                    .build());
        } catch (NumberFormatException e) {
            return ParseResult.failure(e.getMessage());
        }
    }

    private static BigDecimal decimal(String field, String value, BigDecimal defaultValue) {
        try {
            return toDecimalOrDefault(value, defaultValue);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Malformed " + field + ": " + value);
        }
    }
}
