package uk.investir.cgt.core.tax;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Pooled shares of one security and their combined allowable cost. Only the calculator that
 * owns the pool may change it.
 */
@Getter
@ToString
public class Section104Holding {
    private final String isin;
    private BigDecimal quantity;
    private BigDecimal cost;

    Section104Holding(String isin, BigDecimal quantity, BigDecimal cost) {
        this.isin = isin;
        this.quantity = quantity;
        this.cost = cost;
    }

    public BigDecimal getAverageCost() {
        return cost.divide(quantity, MathContext.DECIMAL128);
    }

    void increase(BigDecimal quantity, BigDecimal cost) {
        this.quantity = this.quantity.add(quantity);
        this.cost = this.cost.add(cost);
    }

    /**
     * @return false, leaving the pool untouched, if the pool holds fewer than {@code quantity} shares
     */
    boolean decrease(BigDecimal quantity, BigDecimal cost) {
        if (this.quantity.compareTo(quantity) < 0) {
            return false;
        }
        this.quantity = this.quantity.subtract(quantity);
        this.cost = this.cost.subtract(cost);
        return true;
    }

    boolean isEmpty() {
        return quantity.signum() == 0;
    }
}
