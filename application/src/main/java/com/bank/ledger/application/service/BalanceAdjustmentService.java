package com.bank.ledger.application.service;

import com.bank.ledger.domain.model.AdjustableEntry;
import com.bank.ledger.domain.model.AdjustmentOutcome;
import com.bank.ledger.domain.model.AdjustmentRequest;
import com.bank.ledger.domain.model.LedgerBook;
import com.bank.ledger.domain.model.LotAllocationResult;
import com.bank.ledger.domain.model.PairKey;
import com.bank.ledger.domain.model.PairLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.bank.ledger.domain.util.DecimalUtils.toDecimal;
import static com.bank.ledger.domain.util.DecimalUtils.toPlainText;

/**
 * Writes off inventory that left the account outside the observed trade history
 * (transfers out, sales on another venue) by shrinking pairs to a target remaining volume.
 * Realized figures are never changed by an adjustment.
 */
@Service
public class BalanceAdjustmentService {

    private static final Logger log = LoggerFactory.getLogger(BalanceAdjustmentService.class);

    private final AdjustmentValidationService validationService;

    public BalanceAdjustmentService(AdjustmentValidationService validationService) {
        this.validationService = validationService;
    }

    /**
     * Pairs that still hold inventory, sorted by (base, quote) and numbered from 1
     */
    public List<AdjustableEntry> adjustableEntries(LedgerBook book) {
        List<AdjustableEntry> entries = new ArrayList<>();
        for (PairLedger ledger : book.getLedgers()) {
            if (ledger.hasRemainingVolume()) {
                entries.add(AdjustableEntry.builder()
                        .index(entries.size() + 1)
                        .base(ledger.getPairKey().getBase())
                        .quote(ledger.getPairKey().getQuote())
                        .remainingVolume(toPlainText(ledger.remainingInventory().getVolume()))
                        .build());
            }
        }
        return entries;
    }

    /**
     * Validate every request; errors are prefixed with the request's position (1 based)
     */
    public List<String> validate(LedgerBook book, List<AdjustmentRequest> requests) {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            for (String error : validationService.validate(requests.get(i), book)) {
                errors.add("Adjustment " + (i + 1) + ": " + error);
            }
        }
        return errors;
    }

    /**
     * Apply all requests in order. Nothing is applied if any request is invalid.
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public List<AdjustmentOutcome> apply(LedgerBook book, List<AdjustmentRequest> requests) {
        List<String> errors = validate(book, requests);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid adjustments: " + String.join("; ", errors));
        }

        List<AdjustmentOutcome> outcomes = new ArrayList<>();
        for (AdjustmentRequest request : requests) {
            PairKey key = request.pairKey();
            PairLedger ledger = book.getLedger(key)
                    .orElseThrow(() -> new IllegalStateException("Ledger disappeared for " + key));
            BigDecimal before = ledger.remainingInventory().getVolume();
            BigDecimal target = toDecimal(request.getTargetVolume());

            LotAllocationResult result = ledger.shrinkToTarget(target);

            log.info("Adjusted {} remaining volume from {} to {} ({} lots touched)",
                    key, toPlainText(before), toPlainText(ledger.remainingInventory().getVolume()),
                    result.getAllocations().size());
            outcomes.add(AdjustmentOutcome.builder()
                    .base(key.getBase())
                    .quote(key.getQuote())
                    .previousVolume(toPlainText(before))
                    .targetVolume(toPlainText(target))
                    .removedVolume(toPlainText(result.getMatchedVolume()))
                    .build());
        }
        return outcomes;
    }

    /**
     * Parse "BTC/USD=0,ETH/USD=1.5" into requests; values are validated when applied
     */
    public static List<AdjustmentRequest> parseTargets(String text) {
        List<AdjustmentRequest> requests = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return requests;
        }
        for (String entry : text.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            int eq = entry.indexOf('=');
            if (eq < 0) {
                throw new IllegalArgumentException("Adjustment must be in format BASE/QUOTE=TARGET: " + entry.trim());
            }
            PairKey key = PairKey.parse(entry.substring(0, eq).trim());
            requests.add(AdjustmentRequest.builder()
                    .base(key.getBase())
                    .quote(key.getQuote())
                    .targetVolume(entry.substring(eq + 1).trim())
                    .build());
        }
        return requests;
    }
}
