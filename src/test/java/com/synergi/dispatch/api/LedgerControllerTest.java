package com.synergi.dispatch.api;

import com.synergi.core.ledger.LedgerStats;
import com.synergi.core.ledger.SettlementLedger;
import com.synergi.core.model.SettlementRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LedgerController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SettlementLedger ledger;

    @Test
    void returnsRecentRecordsAndStats() throws Exception {
        SettlementRecord parent = SettlementRecord.direct("SYN-1", "research", "alice", "researcher",
                new BigDecimal("0.010"), "sim_tx_a", false, null).withIdentity(1, Instant.now());
        SettlementRecord child = SettlementRecord.delegatedFrom(parent, "summarization", "summarize",
                new BigDecimal("0.003"), "sim_tx_b").withIdentity(2, Instant.now());
        when(ledger.recent(50)).thenReturn(List.of(child, parent));
        when(ledger.stats()).thenReturn(new LedgerStats(2, 1, new BigDecimal("0.013"), new BigDecimal("0.003"), 1));

        mockMvc.perform(get("/api/v1/ledger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records", hasSize(2)))
                .andExpect(jsonPath("$.records[0].depth").value(1))
                .andExpect(jsonPath("$.records[0].parentRecordId").value(1))
                .andExpect(jsonPath("$.records[0].payerId").value("researcher"))
                .andExpect(jsonPath("$.stats.count").value(2))
                .andExpect(jsonPath("$.stats.maxDepth").value(1));
    }

    @Test
    void honoursLimit() throws Exception {
        when(ledger.recent(5)).thenReturn(List.of());
        when(ledger.stats()).thenReturn(new LedgerStats(0, 0, BigDecimal.ZERO, BigDecimal.ZERO, 0));

        mockMvc.perform(get("/api/v1/ledger").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records", hasSize(0)));

        verify(ledger).recent(5);
    }

    @Test
    void rejectsOutOfRangeLimit() throws Exception {
        mockMvc.perform(get("/api/v1/ledger").param("limit", "0"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/v1/ledger").param("limit", "1001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("1000")));

        verify(ledger, never()).recent(anyInt());
    }
}
