package com.signals.common.model;

/**
 * Direction of a trading signal.
 */
public enum TradeAction {
    BUY, SELL
}
