package com.gomesguardian.common.model;

/** Position of a price relative to a ticker's buy and sell zones. */
public enum ZoneSignal {
    AGGRESSIVE_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL;

    public boolean isSellSide() {
        return this == SELL || this == STRONG_SELL;
    }
}
