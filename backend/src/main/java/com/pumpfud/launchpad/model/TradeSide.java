package com.pumpfud.launchpad.model;

public enum TradeSide {
    BUY,
    SELL,
    BURN
}
