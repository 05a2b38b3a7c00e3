package com.bank.ledger.api.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for ReportController endpoints
 * File sources point at the fixtures under src/test/resources/fixtures
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ReportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testReportFromConfiguredSources() throws Exception {
        mockMvc.perform(get("/api/reports"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied").value(3))
                .andExpect(jsonPath("$.filtered").value(0))
                .andExpect(jsonPath("$.skipped", hasSize(1)))
                .andExpect(jsonPath("$.skipped[0].tradeId").value("TQ1-BAD"))
                .andExpect(jsonPath("$.skipped[0].reason").value(startsWith("Malformed volume")))
                .andExpect(jsonPath("$.rows", hasSize(2)))
                .andExpect(jsonPath("$.rows[0].asset").value("BTC"))
                .andExpect(jsonPath("$.rows[0].avg_buy_price").value("9009"))
                .andExpect(jsonPath("$.rows[0].avg_sell_price").value("9990"))
                .andExpect(jsonPath("$.rows[0].realized_pnl").value("392.4"))
                .andExpect(jsonPath("$.rows[0].unrealized_pnl").value("594.6"))
                .andExpect(jsonPath("$.rows[1].asset").value("ETH"))
                .andExpect(jsonPath("$.rows[1].current_price").value("1600.5"))
                .andExpect(jsonPath("$.rows[1].unrealized_pnl").value("201"));
    }

    @Test
    void testAdjustablePairs() throws Exception {
        mockMvc.perform(get("/api/reports/adjustable"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.entries[0].index").value(1))
                .andExpect(jsonPath("$.entries[0].base").value("BTC"))
                .andExpect(jsonPath("$.entries[0].remainingVolume").value("0.6"))
                .andExpect(jsonPath("$.entries[1].base").value("ETH"));
    }

    @Test
    void testReportFromRequestBodyWithAdjustment() throws Exception {
        String body = "{"
                + "\"trades\": ["
                + "{\"tradeId\": \"A\", \"pair\": \"SOLUSD\", \"type\": \"buy\", \"price\": \"20\", \"vol\": \"10\", \"fee\": \"0\", \"time\": 1},"
                + "{\"tradeId\": \"B\", \"pair\": \"SOLUSD\", \"type\": \"buy\", \"price\": \"30\", \"vol\": \"10\", \"fee\": \"0\", \"time\": 2}"
                + "],"
                + "\"prices\": {\"SOLUSD\": 40},"
                + "\"adjustments\": [{\"base\": \"SOL\", \"quote\": \"USD\", \"targetVolume\": \"5\"}]"
                + "}";

        mockMvc.perform(post("/api/reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows[0].total_bought").value("20"))
                .andExpect(jsonPath("$.rows[0].remaining_unsold_volume").value("5"))
                .andExpect(jsonPath("$.rows[0].avg_buy_price_of_remaining").value("30"))
                .andExpect(jsonPath("$.rows[0].realized_pnl").value("0"))
                .andExpect(jsonPath("$.rows[0].unrealized_pnl").value("50"))
                .andExpect(jsonPath("$.adjustments[0].removedVolume").value("15"));
    }

    @Test
    void testNegativeAdjustmentTargetIsBadRequest() throws Exception {
        String body = "{"
                + "\"trades\": [{\"tradeId\": \"A\", \"pair\": \"SOLUSD\", \"type\": \"buy\", \"price\": \"20\", \"vol\": \"10\", \"fee\": \"0\", \"time\": 1}],"
                + "\"prices\": {},"
                + "\"adjustments\": [{\"base\": \"SOL\", \"quote\": \"USD\", \"targetVolume\": \"-1\"}]"
                + "}";

        mockMvc.perform(post("/api/reports")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Target cannot be negative")));
    }

    @Test
    void testCorrelationIdIsEchoed() throws Exception {
        mockMvc.perform(get("/api/reports/adjustable").header("X-Correlation-ID", "corr-42"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "corr-42"));
    }
}
