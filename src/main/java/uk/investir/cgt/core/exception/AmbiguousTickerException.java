package uk.investir.cgt.core.exception;

import lombok.Getter;

@Getter
public class AmbiguousTickerException extends InvestirException {
    private final String ticker;

    public AmbiguousTickerException(String ticker) {
        super(String.format("Ticker %s is ambiguous (used on different securities)", ticker));
        this.ticker = ticker;
    }
}
