package com.signals.common.kafka;

/**
 * The broker could not be reached, or it refused a send.
 * Fatal for the process that raises it.
 */
public class BrokerUnavailableException extends RuntimeException {

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
