package com.bank.ledger.domain.valuation;

import com.bank.ledger.domain.model.LedgerBook;
import com.bank.ledger.domain.model.Lot;
import com.bank.ledger.domain.model.PairLedger;
import com.bank.ledger.domain.model.RemainingInventory;
import com.bank.ledger.domain.model.ReportRow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.bank.ledger.domain.util.DecimalUtils.safeDivide;
import static com.bank.ledger.domain.util.DecimalUtils.toPlainText;

/**
 * Turns ledgers plus current prices into report rows.
 * A pair with no price reports zero for both current price and unrealized PnL.
 */
public class ValuationCalculator {

    /**
     * @param pricesByPairIdentifier current prices keyed by raw exchange identifier
     * @return one row per ledger, sorted by (base, quote)
     */
    public List<ReportRow> compute(LedgerBook book, Map<String, BigDecimal> pricesByPairIdentifier) {
        List<ReportRow> rows = new ArrayList<>();
        for (PairLedger ledger : book.getLedgers()) {
            BigDecimal price = null;
            if (ledger.getExamplePairIdentifier() != null) {
                price = pricesByPairIdentifier.get(ledger.getExamplePairIdentifier());
            }
            rows.add(valuate(ledger, price != null ? price : BigDecimal.ZERO));
        }
        return rows;
    }

    public ReportRow valuate(PairLedger ledger, BigDecimal currentPrice) {
        RemainingInventory remaining = ledger.remainingInventory();
        return ReportRow.builder()
                .asset(ledger.getPairKey().getBase())
                .quote(ledger.getPairKey().getQuote())
                .totalBought(toPlainText(ledger.getBuyVolume()))
                .avgBuyPrice(toPlainText(safeDivide(ledger.getBuyCost(), ledger.getBuyVolume())))
                .totalSold(toPlainText(ledger.getSellVolume()))
                .avgSellPrice(toPlainText(safeDivide(ledger.getSellProceeds(), ledger.getSellVolume())))
                .netFromHistory(toPlainText(ledger.getBuyVolume().subtract(ledger.getSellVolume())))
                .remainingUnsoldVolume(toPlainText(remaining.getVolume()))
                .avgBuyPriceOfRemaining(toPlainText(remaining.getAverageCost()))
                .feesTotal(toPlainText(ledger.getFeesTotal()))
                .realizedPnl(toPlainText(ledger.getRealizedPnl()))
                .currentPrice(toPlainText(currentPrice))
                .unrealizedPnl(toPlainText(unrealizedPnl(ledger, remaining, currentPrice)))
                .build();
    }

    /**
     * Sum over open lots of (price - unit cost) * remaining volume
     */
    public BigDecimal unrealizedPnl(PairLedger ledger, RemainingInventory remaining, BigDecimal currentPrice) {
        BigDecimal unrealized = BigDecimal.ZERO;
        if (currentPrice.signum() <= 0 || remaining.getVolume().signum() <= 0) {
            return unrealized;
        }
        for (Lot lot : ledger.getLots()) {
            unrealized = unrealized.add(currentPrice.subtract(lot.getUnitCost()).multiply(lot.getRemainingVolume()));
        }
        return unrealized;
    }
}
