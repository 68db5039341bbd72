package uk.investir.cgt.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Shares bought. The total is the allowable cost, fees included.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class Acquisition extends Order {

    @Override
    public OrderDirection getDirection() {
        return OrderDirection.BUY;
    }

    public Money getCostBeforeFees() {
        return getTotal().subtract(getFees().getTotal());
    }

    @Override
    public BigDecimal getPrice() {
        return getCostBeforeFees().getAmount().divide(getQuantity(), MathContext.DECIMAL128);
    }

    @Override
    protected Money totalExcluding(Money fee) {
        return getTotal().subtract(fee);
    }
}
