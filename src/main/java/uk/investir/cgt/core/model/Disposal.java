package uk.investir.cgt.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Shares sold. The total is the net amount received, fees already deducted.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class Disposal extends Order {

    @Override
    public OrderDirection getDirection() {
        return OrderDirection.SELL;
    }

    public Money getGrossProceeds() {
        return getTotal().add(getFees().getTotal());
    }

    @Override
    public BigDecimal getPrice() {
        return getGrossProceeds().getAmount().divide(getQuantity(), MathContext.DECIMAL128);
    }

    @Override
    protected Money totalExcluding(Money fee) {
        return getTotal().add(fee);
    }
}
