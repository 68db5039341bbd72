package uk.investir.cgt.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Fees incurred on a share acquisition or disposal. Every category is optional; arithmetic is
 * component-wise and an absent component stays absent unless the other operand has it.
 */
@Value
@Builder(toBuilder = true)
public class Fees {
    /** Stamp Duty or Stamp Duty Reserve Tax. */
    Money stampDuty;
    /** Currency conversion fee. */
    Money forex;
    /** Financial Industry Regulatory Authority fee. */
    Money finra;
    /** Securities and Exchange Commission fee. */
    Money sec;
    Currency defaultCurrency;

    public static Fees none(Currency currency) {
        return Fees.builder().defaultCurrency(currency).build();
    }

    public Money getTotal() {
        return Stream.of(stampDuty, forex, finra, sec)
                .filter(fee -> fee != null)
                .reduce(Money::add)
                .orElseGet(() -> Money.zero(defaultCurrency));
    }

    public boolean hasForex() {
        return forex != null && !forex.isZero();
    }

    public Fees withoutForex() {
        return toBuilder().forex(null).build();
    }

    public Fees plus(Fees other) {
        return combine(other, (a, b) -> a == null ? b : b == null ? a : a.add(b));
    }

    public Fees minus(Fees other) {
        return combine(other, (a, b) -> a == null ? (b == null ? null : b.negate()) : b == null ? a : a.subtract(b));
    }

    public Fees multiply(BigDecimal factor) {
        return scale(fee -> fee.multiply(factor));
    }

    public Fees divide(BigDecimal divisor) {
        return scale(fee -> fee.divide(divisor));
    }

    private Fees combine(Fees other, BinaryOperator<Money> op) {
        return new Fees(
                op.apply(stampDuty, other.stampDuty),
                op.apply(forex, other.forex),
                op.apply(finra, other.finra),
                op.apply(sec, other.sec),
                defaultCurrency);
    }

    private Fees scale(UnaryOperator<Money> op) {
        return new Fees(
                stampDuty != null ? op.apply(stampDuty) : null,
                forex != null ? op.apply(forex) : null,
                finra != null ? op.apply(finra) : null,
                sec != null ? op.apply(sec) : null,
                defaultCurrency);
    }
}
