package uk.investir.cgt.core.exception;

import java.math.BigDecimal;

public class CalculatedAmountException extends InvestirException {

    public CalculatedAmountException(String transactionId, BigDecimal expected, BigDecimal calculated) {
        super(String.format("Calculated amount (%s) is different than the expected value (%s) for transaction %s",
                calculated, expected, transactionId));
    }
}
