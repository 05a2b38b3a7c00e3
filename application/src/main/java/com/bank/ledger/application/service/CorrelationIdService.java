package com.bank.ledger.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Keeps the id of the current request or batch run in the MDC so every log line can carry it
 */
@Service
public class CorrelationIdService {

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdService.class);

    static final String CORRELATION_ID_KEY = "correlationId";

    /**
     * Adopt the caller's correlation ID, or generate one when none was sent
     * @return the ID now in the MDC
     */
    public String begin(String incomingId) {
        String correlationId = incomingId != null && !incomingId.isBlank()
                ? incomingId.trim()
                : UUID.randomUUID().toString();
        MDC.put(CORRELATION_ID_KEY, correlationId);
        log.debug("Correlation ID: {}", correlationId);
        return correlationId;
    }

    /**
     * Correlation ID for a batch run, timestamp prefixed so runs sort in the log
     */
    public String beginBatch() {
        String correlationId = String.format("batch-%d-%s",
                System.currentTimeMillis(), UUID.randomUUID().toString().substring(0, 8));
        MDC.put(CORRELATION_ID_KEY, correlationId);
        return correlationId;
    }

    public String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY);
    }

    public void clear() {
        MDC.remove(CORRELATION_ID_KEY);
    }
}
