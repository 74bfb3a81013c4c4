package com.signals.processor.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.signals.common.model.TradeRecord;
import com.signals.processor.service.TradeHistoryService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for inspecting processed trades.
 */
@RestController
@RequestMapping("/api/v1/trades")
@RequiredArgsConstructor
@Slf4j
public class TradeHistoryController {

    private final TradeHistoryService tradeHistoryService;

    @GetMapping("/history")
    public ResponseEntity<List<TradeRecord>> getHistory(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(tradeHistoryService.recentTrades(limit));
    }

    @GetMapping("/count/{assetId}")
    public ResponseEntity<TradeCountResponse> getCount(@PathVariable String assetId) {
        return ResponseEntity.ok(new TradeCountResponse(assetId, tradeHistoryService.tradeCount(assetId)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        log.warn("Invalid trade history request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
    }

    public record TradeCountResponse(String assetId, long count) {}

    public record ErrorResponse(String message) {}
}
