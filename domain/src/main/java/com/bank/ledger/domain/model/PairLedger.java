package com.bank.ledger.domain.model;

import lombok.AccessLevel;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static com.bank.ledger.domain.util.DecimalUtils.safeDivide;

/**
 * FIFO lot ledger for one (base, quote) pair.
 * <p>
 * Buys append a lot to the tail of the queue. Sells and shrinks consume lots from the
 * head, splitting the oldest lot when the volume ends inside it. The queue is never
 * reordered and lots are only reachable through this class.
 */
@Getter
public class PairLedger {

    private static final Logger log = LoggerFactory.getLogger(PairLedger.class);

    private final PairKey pairKey;

    private BigDecimal buyVolume = BigDecimal.ZERO;
    private BigDecimal buyCost = BigDecimal.ZERO;
    private BigDecimal sellVolume = BigDecimal.ZERO;
    private BigDecimal sellProceeds = BigDecimal.ZERO;
    private BigDecimal feesTotal = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    /**
     * Volume removed by {@link #shrinkToTarget(BigDecimal)}
     */
    private BigDecimal shrunkVolume = BigDecimal.ZERO;

    /**
     * Sell volume that found no open lot to match (history starts after the buys)
     */
    private BigDecimal unmatchedSellVolume = BigDecimal.ZERO;

    private BigDecimal lastSeenTimestamp = BigDecimal.ZERO;
    private String examplePairIdentifier;

    @Getter(AccessLevel.NONE)
    private final Deque<Lot> lots = new ArrayDeque<>();

    @Getter(AccessLevel.NONE)
    private long lotSequence;

    public PairLedger(PairKey pairKey) {
        this.pairKey = pairKey;
    }

    /**
     * Record a buy and append its lot.
     *
     * @param cost trade cost; null means volume * price
     * @return the lot appended to the queue
     */
    public Lot applyBuy(BigDecimal volume, BigDecimal price, BigDecimal cost, BigDecimal fee,
                        boolean includeFeeInCost) {
        BigDecimal tradeCost = cost != null ? cost : volume.multiply(price);
        BigDecimal totalCost = includeFeeInCost ? tradeCost.add(fee) : tradeCost;

        buyVolume = buyVolume.add(volume);
        buyCost = buyCost.add(totalCost);
        feesTotal = feesTotal.add(fee);

        Lot lot = Lot.builder()
                .id(nextLotId())
                .remainingVolume(volume)
                .unitCost(safeDivide(totalCost, volume))
                .build();
        lots.addLast(lot);

        log.debug("{}: added lot {} volume={} unitCost={}", pairKey, lot.getId(), volume, lot.getUnitCost());
        return lot;
    }

    /**
     * Record a sell and match it against the oldest lots.
     * Selling more than the open lots hold consumes every lot; the excess is reported as
     * unmatched volume and earns no realized PnL.
     *
     * @param cost trade value; null means volume * price
     */
    public LotAllocationResult applySell(BigDecimal volume, BigDecimal price, BigDecimal cost, BigDecimal fee,
                                         boolean includeFeeInCost) {
        BigDecimal tradeValue = cost != null ? cost : volume.multiply(price);
        BigDecimal proceeds = includeFeeInCost ? tradeValue.subtract(fee) : tradeValue;

        sellVolume = sellVolume.add(volume);
        sellProceeds = sellProceeds.add(proceeds);
        feesTotal = feesTotal.add(fee);

        BigDecimal perUnitProceeds = safeDivide(proceeds, volume);
        LotAllocationResult result = consumeFromHead(volume, perUnitProceeds);
        realizedPnl = realizedPnl.add(result.getTotalRealizedPnl());

        if (result.hasUnmatchedVolume()) {
            unmatchedSellVolume = unmatchedSellVolume.add(result.getUnmatchedVolume());
            log.warn("{}: sell of {} exceeds open lots, {} left unmatched (incomplete buy history?)",
                    pairKey, volume, result.getUnmatchedVolume());
        }
        return result;
    }

    /**
     * Remaining volume and cost summed over the open lots
     */
    public RemainingInventory remainingInventory() {
        BigDecimal volume = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (Lot lot : lots) {
            volume = volume.add(lot.getRemainingVolume());
            cost = cost.add(lot.getTotalCost());
        }
        return new RemainingInventory(volume, cost);
    }

    /**
     * Reduce the open lots, oldest first, until they hold {@code targetVolume}.
     * Models disposals that happened outside the observed history, so sell totals, fees
     * and realized PnL are left untouched. A target at or above the current remaining
     * volume changes nothing.
     */
    public LotAllocationResult shrinkToTarget(BigDecimal targetVolume) {
        if (targetVolume.signum() < 0) {
            throw new IllegalArgumentException("Target volume cannot be negative");
        }
        BigDecimal current = remainingInventory().getVolume();
        if (targetVolume.compareTo(current) >= 0) {
            return new LotAllocationResult();
        }
        LotAllocationResult result = consumeFromHead(current.subtract(targetVolume), null);
        shrunkVolume = shrunkVolume.add(result.getMatchedVolume());
        log.info("{}: shrunk remaining volume from {} to {}", pairKey, current, targetVolume);
        return result;
    }

    /**
     * Track the newest trade time and keep one raw identifier for price lookups
     */
    public void recordObservation(String pairIdentifier, BigDecimal timestamp) {
        if (timestamp != null && timestamp.compareTo(lastSeenTimestamp) > 0) {
            lastSeenTimestamp = timestamp;
        }
        if (examplePairIdentifier == null && pairIdentifier != null && !pairIdentifier.isEmpty()) {
            examplePairIdentifier = pairIdentifier;
        }
    }

    /**
     * Snapshot of the open lots in FIFO order
     */
    public List<Lot> getLots() {
        return List.copyOf(lots);
    }

    public boolean hasRemainingVolume() {
        return remainingInventory().getVolume().signum() > 0;
    }

    /**
     * @param perUnitProceeds null when consuming without realizing (shrink)
     */
    private LotAllocationResult consumeFromHead(BigDecimal volume, BigDecimal perUnitProceeds) {
        LotAllocationResult result = new LotAllocationResult();
        BigDecimal remaining = volume;

        while (remaining.signum() > 0 && !lots.isEmpty()) {
            Lot head = lots.peekFirst();
            BigDecimal use = head.getRemainingVolume().min(remaining);

            BigDecimal realized = null;
            if (perUnitProceeds != null) {
                realized = use.multiply(perUnitProceeds).subtract(use.multiply(head.getUnitCost()));
            }
            if (use.signum() > 0) {
                result.addAllocation(head.getId(), use, head.getUnitCost(), realized);
            }

            Lot reduced = head.reduce(use);
            lots.pollFirst();
            if (!reduced.isExhausted()) {
                lots.addFirst(reduced);
            }
            remaining = remaining.subtract(use);

            log.debug("{}: consumed {} from lot {}, left {}", pairKey, use, head.getId(), reduced.getRemainingVolume());
        }

        result.setUnmatchedVolume(remaining);
        return result;
    }

    private String nextLotId() {
        return pairKey.getBase() + "/" + pairKey.getQuote() + "#" + (++lotSequence);
    }
}
