package com.signals.common.codec;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signals.common.model.TradeRecord;
import com.signals.common.model.TradeSignal;

/**
 * JSON encoding of the queue and store payloads.
 * Both the generator and the trade processors go through this class so the wire shape
 * has a single definition.
 */
public class TradeSignalCodec {

    private final ObjectMapper objectMapper;

    public TradeSignalCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(TradeSignal signal) {
        return write(signal);
    }

    public byte[] encodeBytes(TradeSignal signal) {
        return encode(signal).getBytes(StandardCharsets.UTF_8);
    }

    public String encode(TradeRecord record) {
        return write(record);
    }

    public TradeSignal decode(byte[] payload) {
        if (payload == null) {
            throw new MalformedMessageException("Empty payload");
        }
        return decode(new String(payload, StandardCharsets.UTF_8));
    }

    /**
     * Parses and checks a signal payload.
     *
     * @throws MalformedMessageException if the payload is not JSON, or a required field is missing or invalid
     */
    public TradeSignal decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedMessageException("Empty payload");
        }

        TradeSignal signal;
        try {
            signal = objectMapper.readValue(payload, TradeSignal.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Payload is not a trade signal: " + e.getOriginalMessage(), e);
        }

        if (signal == null) {
            throw new MalformedMessageException("Payload is null");
        }
        if (signal.getAssetId() == null || signal.getAssetId().isBlank()) {
            throw new MalformedMessageException("Missing assetId");
        }
        if (signal.getAction() == null) {
            throw new MalformedMessageException("Missing action");
        }
        if (signal.getVolume() == null || !Double.isFinite(signal.getVolume()) || signal.getVolume() <= 0) {
            throw new MalformedMessageException("Volume must be a positive finite number: " + signal.getVolume());
        }
        if (signal.getTimestamp() == null) {
            throw new MalformedMessageException("Missing timestamp");
        }
        try {
            Instant.parse(signal.getTimestamp());
        } catch (DateTimeParseException e) {
            throw new MalformedMessageException("Timestamp is not ISO-8601: " + signal.getTimestamp(), e);
        }
        return signal;
    }

    public TradeRecord decodeRecord(String payload) {
        try {
            return objectMapper.readValue(payload, TradeRecord.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Payload is not a trade record: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
