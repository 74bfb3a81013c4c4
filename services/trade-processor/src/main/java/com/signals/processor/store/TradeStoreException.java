package com.signals.processor.store;

/**
 * A store call failed. Processing of the current message is retried by redelivery.
 */
public class TradeStoreException extends RuntimeException {

    public TradeStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public TradeStoreException(String message) {
        super(message);
    }
}
