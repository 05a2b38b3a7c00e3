package com.bank.ledger.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read-only per-pair snapshot handed to report consumers.
 * Every figure is an exact decimal rendered as plain text.
 */
@Value
@Builder
@JsonPropertyOrder({
        "asset", "quote", "total_bought", "avg_buy_price", "total_sold", "avg_sell_price",
        "net_from_history", "remaining_unsold_volume", "avg_buy_price_of_remaining",
        "fees_total", "realized_pnl", "current_price", "unrealized_pnl"})
public class ReportRow {

    public static final List<String> COLUMNS = List.of(
            "asset", "quote", "total_bought", "avg_buy_price", "total_sold", "avg_sell_price",
            "net_from_history", "remaining_unsold_volume", "avg_buy_price_of_remaining",
            "fees_total", "realized_pnl", "current_price", "unrealized_pnl");

    @JsonProperty("asset")
    String asset;
    @JsonProperty("quote")
    String quote;
    @JsonProperty("total_bought")
    String totalBought;
    @JsonProperty("avg_buy_price")
    String avgBuyPrice;
    @JsonProperty("total_sold")
    String totalSold;
    @JsonProperty("avg_sell_price")
    String avgSellPrice;
    @JsonProperty("net_from_history")
    String netFromHistory; // Units, not money
    @JsonProperty("remaining_unsold_volume")
    String remainingUnsoldVolume;
    @JsonProperty("avg_buy_price_of_remaining")
    String avgBuyPriceOfRemaining;
    @JsonProperty("fees_total")
    String feesTotal;
    @JsonProperty("realized_pnl")
    String realizedPnl;
    @JsonProperty("current_price")
    String currentPrice;
    @JsonProperty("unrealized_pnl")
    String unrealizedPnl;

    /**
     * Values in {@link #COLUMNS} order
     */
    public String[] values() {
        return new String[]{
                asset, quote, totalBought, avgBuyPrice, totalSold, avgSellPrice,
                netFromHistory, remainingUnsoldVolume, avgBuyPriceOfRemaining,
                feesTotal, realizedPnl, currentPrice, unrealizedPnl};
    }
}
