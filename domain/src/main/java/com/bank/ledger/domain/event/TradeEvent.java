package com.bank.ledger.domain.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw trade record as delivered by a trade source.
 * Fields stay textual so a bad value skips one record instead of failing the batch;
 * property names follow the Kraken TradesHistory payload.
 */
@Data
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradeEvent {
    private String tradeId;
    @JsonProperty("ordertxid")
    private String orderTxId;
    private String pair; // Exchange identifier, e.g. XXBTZUSD
    @JsonProperty("type")
    private String side; // buy | sell, any case
    @JsonProperty("ordertype")
    private String orderType;
    private String price;
    private String cost; // Optional, volume * price when absent
    private String fee;
    @JsonProperty("vol")
    private String volume;
    private String time; // Epoch seconds, may carry a fraction
}
