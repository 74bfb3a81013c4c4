package com.signals.processor.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.signals.common.model.TradeAction;
import com.signals.common.model.TradeRecord;
import com.signals.common.model.TradeSignal;
import com.signals.processor.service.TradeHistoryService;

class TradeHistoryControllerTest {

    private TradeHistoryService historyService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        historyService = mock(TradeHistoryService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new TradeHistoryController(historyService)).build();
    }

    @Test
    void historyListsRecords() throws Exception {
        TradeRecord record = TradeRecord.of(TradeSignal.of("X", TradeAction.BUY, 50.5, "2026-05-04T12:00:00Z"), 75.5);
        when(historyService.recentTrades(100)).thenReturn(List.of(record));

        mockMvc.perform(get("/api/v1/trades/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].assetId").value("X"))
                .andExpect(jsonPath("$[0].totalValue").value("3812.75"));
    }

    @Test
    void countIsReturnedPerAsset() throws Exception {
        when(historyService.tradeCount("X")).thenReturn(4L);

        mockMvc.perform(get("/api/v1/trades/count/X"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assetId").value("X"))
                .andExpect(jsonPath("$.count").value(4));
    }

    @Test
    void invalidLimitIsBadRequest() throws Exception {
        when(historyService.recentTrades(0)).thenThrow(new IllegalArgumentException("Limit must be positive"));

        mockMvc.perform(get("/api/v1/trades/history").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Limit must be positive"));
    }
}
