package com.signals.common.codec;

/**
 * Raised when a queue payload does not decode to a valid {@link com.signals.common.model.TradeSignal}.
 * Such messages are dropped, never redelivered.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
