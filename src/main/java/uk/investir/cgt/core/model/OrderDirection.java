package uk.investir.cgt.core.model;

public enum OrderDirection {
    BUY,
    SELL
}
