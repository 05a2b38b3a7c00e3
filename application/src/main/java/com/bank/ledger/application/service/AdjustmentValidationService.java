package com.bank.ledger.application.service;

import com.bank.ledger.domain.model.AdjustmentRequest;
import com.bank.ledger.domain.model.LedgerBook;
import com.bank.ledger.domain.model.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.bank.ledger.domain.util.DecimalUtils.toDecimal;

/**
 * Validation gate for balance adjustments.
 * Runs before any ledger is touched; a ledger is never asked to shrink to a negative target.
 */
@Service
public class AdjustmentValidationService {

    private static final Logger log = LoggerFactory.getLogger(AdjustmentValidationService.class);

    /**
     * Validate one adjustment against the booked ledgers
     * @return Empty list if valid, list of error messages if invalid
     */
    public List<String> validate(AdjustmentRequest request, LedgerBook book) {
        List<String> errors = new ArrayList<>();
        if (request == null) {
            errors.add("Adjustment is required");
            return errors;
        }

        boolean hasBase = request.getBase() != null && !request.getBase().isBlank();
        boolean hasQuote = request.getQuote() != null && !request.getQuote().isBlank();
        if (!hasBase) {
            errors.add("Base asset is required");
        }
        if (!hasQuote) {
            errors.add("Quote currency is required");
        }

        if (request.getTargetVolume() == null || request.getTargetVolume().isBlank()) {
            errors.add("Target volume is required");
        } else {
            try {
                BigDecimal target = toDecimal(request.getTargetVolume());
                if (target.signum() < 0) {
                    errors.add("Target cannot be negative: " + request.getTargetVolume().trim());
                }
            } catch (NumberFormatException e) {
                errors.add("Target volume must be a number (e.g. 0 or 0.123456): " + request.getTargetVolume().trim());
            }
        }

        if (hasBase && hasQuote) {
            PairKey key = request.pairKey();
            if (book.getLedger(key).isEmpty()) {
                errors.add("Unknown pair: " + key);
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Adjustment rejected for {}/{}: {}", request.getBase(), request.getQuote(), errors);
        }
        return errors;
    }
}
