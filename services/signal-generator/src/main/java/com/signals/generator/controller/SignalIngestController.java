package com.signals.generator.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.signals.common.kafka.BrokerUnavailableException;
import com.signals.common.model.TradeSignal;
import com.signals.generator.service.SignalIngestionService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for submitting trading signals produced elsewhere.
 * Responds as soon as the signal is handed to the broker.
 */
@RestController
@RequestMapping("/api/v1/signals")
@RequiredArgsConstructor
@Slf4j
public class SignalIngestController {

    private final SignalIngestionService signalIngestionService;

    @PostMapping
    public ResponseEntity<SignalResponse> submitSignal(@Valid @RequestBody TradeSignal signalRequest) {
        log.info("Received signal: {} {} MWh for {}",
                signalRequest.getAction(), signalRequest.getVolume(), signalRequest.getAssetId());

        try {
            TradeSignal queued = signalIngestionService.ingestSignal(signalRequest);

            return ResponseEntity.status(HttpStatus.ACCEPTED).body(SignalResponse.builder()
                    .accepted(true)
                    .assetId(queued.getAssetId())
                    .signalTimestamp(queued.getTimestamp())
                    .message("Signal accepted and queued for processing.")
                    .timestamp(System.currentTimeMillis())
                    .build());

        } catch (IllegalArgumentException e) {
            log.warn("Invalid signal request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(rejection(e.getMessage()));
        } catch (BrokerUnavailableException e) {
            log.error("Broker unavailable while queuing signal", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(rejection("Broker unavailable"));
        }
    }

    @ExceptionHandler({ MethodArgumentNotValidException.class, BindException.class })
    public ResponseEntity<SignalResponse> handleValidationExceptions(BindException ex) {
        String message = "Invalid signal payload";

        if (ex.getBindingResult().hasFieldErrors()) {
            var fe = ex.getBindingResult().getFieldErrors().get(0);
            message = fe.getField() + ": " + fe.getDefaultMessage();
        }

        return ResponseEntity.badRequest().body(rejection(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<SignalResponse> handleUnreadableJson(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(rejection("Malformed JSON"));
    }

    private static SignalResponse rejection(String message) {
        return SignalResponse.builder()
                .accepted(false)
                .message(message)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    @lombok.Data
    @lombok.Builder
    public static class SignalResponse {
        private Boolean accepted;
        private String assetId;
        private String signalTimestamp;
        private String message;
        private Long timestamp;
    }
}
