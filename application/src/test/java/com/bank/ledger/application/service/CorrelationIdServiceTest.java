package com.bank.ledger.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdServiceTest {

    private final CorrelationIdService correlationIdService = new CorrelationIdService();

    @AfterEach
    void tearDown() {
        correlationIdService.clear();
    }

    @Test
    void testIncomingIdIsAdopted() {
        String id = correlationIdService.begin(" abc-123 ");

        assertEquals("abc-123", id);
        assertEquals("abc-123", MDC.get(CorrelationIdService.CORRELATION_ID_KEY));
    }

    @Test
    void testMissingIdIsGenerated() {
        String id = correlationIdService.begin(null);

        assertNotNull(id);
        assertFalse(id.isBlank());
        assertEquals(id, correlationIdService.getCurrentCorrelationId());
    }

    @Test
    void testBatchIdAndClear() {
        String id = correlationIdService.beginBatch();

        assertTrue(id.startsWith("batch-"));
        correlationIdService.clear();
        assertNull(correlationIdService.getCurrentCorrelationId());
    }
}
