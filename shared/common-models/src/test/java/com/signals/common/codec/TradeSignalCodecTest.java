package com.signals.common.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signals.common.model.TradeAction;
import com.signals.common.model.TradeRecord;
import com.signals.common.model.TradeSignal;

class TradeSignalCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TradeSignalCodec codec = new TradeSignalCodec(objectMapper);

    @Test
    @DisplayName("encodes the four wire fields")
    void encodesWireShape() throws Exception {
        TradeSignal signal = TradeSignal.of("BATTERY_GRID_01", TradeAction.BUY, 45.5, "2026-03-01T10:15:30Z");

        JsonNode json = objectMapper.readTree(codec.encode(signal));

        assertThat(json.get("assetId").asText()).isEqualTo("BATTERY_GRID_01");
        assertThat(json.get("action").asText()).isEqualTo("BUY");
        assertThat(json.get("volume").asDouble()).isEqualTo(45.5);
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-03-01T10:15:30Z");
        assertThat(json.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("decodes a UTF-8 payload produced by another service")
    void decodesBytes() {
        byte[] payload = "{\"assetId\":\"X\",\"action\":\"SELL\",\"volume\":12.25,\"timestamp\":\"2026-03-01T10:15:30.123Z\"}"
                .getBytes(StandardCharsets.UTF_8);

        TradeSignal signal = codec.decode(payload);

        assertThat(signal).isEqualTo(TradeSignal.of("X", TradeAction.SELL, 12.25, "2026-03-01T10:15:30.123Z"));
    }

    @Test
    @DisplayName("trade records keep price and totalValue")
    void recordsCarryValuation() {
        TradeRecord record = TradeRecord.of(TradeSignal.of("X", TradeAction.BUY, 50.5, "2026-03-01T10:15:30Z"), 75.5);

        TradeRecord decoded = codec.decodeRecord(codec.encode(record));

        assertThat(decoded).isEqualTo(record);
        assertThat(decoded.getTotalValue()).isEqualTo("3812.75");
    }

    @Nested
    @DisplayName("malformed payloads")
    class Malformed {

        @Test
        void notJson() {
            assertThatThrownBy(() -> codec.decode("not valid json"))
                    .isInstanceOf(MalformedMessageException.class);
        }

        @Test
        void emptyPayload() {
            assertThatThrownBy(() -> codec.decode("")).isInstanceOf(MalformedMessageException.class);
            assertThatThrownBy(() -> codec.decode((byte[]) null)).isInstanceOf(MalformedMessageException.class);
        }

        @Test
        void jsonNull() {
            assertThatThrownBy(() -> codec.decode("null")).isInstanceOf(MalformedMessageException.class);
        }

        @Test
        void missingAssetId() {
            assertThatThrownBy(() -> codec.decode(
                    "{\"action\":\"BUY\",\"volume\":10,\"timestamp\":\"2026-03-01T10:15:30Z\"}"))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("assetId");
        }

        @Test
        void unknownAction() {
            assertThatThrownBy(() -> codec.decode(
                    "{\"assetId\":\"X\",\"action\":\"HOLD\",\"volume\":10,\"timestamp\":\"2026-03-01T10:15:30Z\"}"))
                    .isInstanceOf(MalformedMessageException.class);
        }

        @Test
        void nonPositiveVolume() {
            assertThatThrownBy(() -> codec.decode(
                    "{\"assetId\":\"X\",\"action\":\"BUY\",\"volume\":0,\"timestamp\":\"2026-03-01T10:15:30Z\"}"))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("Volume");
        }

        @Test
        @DisplayName("a volume beyond double range decodes to Infinity and is rejected")
        void volumeOverflow() {
            assertThatThrownBy(() -> codec.decode(
                    "{\"assetId\":\"X\",\"action\":\"BUY\",\"volume\":1e400,\"timestamp\":\"2026-03-01T10:15:30Z\"}"))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("finite");
        }

        @Test
        void timestampNotIso() {
            assertThatThrownBy(() -> codec.decode(
                    "{\"assetId\":\"X\",\"action\":\"BUY\",\"volume\":10,\"timestamp\":\"yesterday\"}"))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("ISO-8601");
        }
    }
}
