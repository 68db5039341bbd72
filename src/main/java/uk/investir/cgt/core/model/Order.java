package uk.investir.cgt.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import uk.investir.cgt.core.exception.InvariantViolationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * A share acquisition or disposal. Orders are immutable: splitting, merging and adjusting an
 * order always yields new instances whose notes name the order(s) they came from.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public abstract class Order extends Transaction {
    @EqualsAndHashCode.Exclude
    private final long sequence;
    @NonNull
    private final String isin;
    private final String ticker;
    private final String name;
    @NonNull
    private final BigDecimal quantity;
    private final BigDecimal originalQuantity;
    @NonNull
    private final Fees fees;

    public abstract OrderDirection getDirection();

    /**
     * Cost before fees for an acquisition, gross proceeds for a disposal, per share.
     */
    public abstract BigDecimal getPrice();

    /**
     * Total amount once the given fee is no longer counted as part of this order.
     */
    protected abstract Money totalExcluding(Money fee);

    public abstract OrderBuilder<?, ?> toBuilder();

    /**
     * Quantity as it appeared in the original record, before any share split restatement.
     */
    public BigDecimal getReportedQuantity() {
        return originalQuantity != null ? originalQuantity : quantity;
    }

    public <T extends Order> T withSequence(long sequence) {
        return derive(this, b -> b.sequence(sequence));
    }

    /**
     * Splits an order in two: the first part holds exactly {@code quantity} shares and the
     * matching fraction of the total and fees, the second part holds the rest. Both parts add up
     * to the original order without loss.
     */
    public static <T extends Order> OrderSplit<T> split(T order, BigDecimal quantity, OrderSequence sequence) {
        if (quantity.signum() <= 0 || quantity.compareTo(order.getQuantity()) > 0) {
            throw new InvariantViolationException(String.format(
                    "Cannot split %s shares from order %d holding %s", quantity, order.getSequence(), order.getQuantity()));
        }

        // Multiply before dividing so that exact allocations stay exact.
        Money matchTotal = order.getTotal().multiply(quantity).divide(order.getQuantity());
        Fees matchFees = order.getFees().multiply(quantity).divide(order.getQuantity());
        BigDecimal matchOriginal = order.getOriginalQuantity() != null
                ? order.getOriginalQuantity().multiply(quantity).divide(order.getQuantity(), MathContext.DECIMAL128)
                : null;
        String notes = "Split from order " + order.getSequence();

        T match = derive(order, b -> b
                .sequence(sequence.next())
                .total(matchTotal)
                .quantity(quantity)
                .originalQuantity(matchOriginal)
                .fees(matchFees)
                .notes(notes));
        T remainder = derive(order, b -> b
                .sequence(sequence.next())
                .total(order.getTotal().subtract(matchTotal))
                .quantity(order.getQuantity().subtract(quantity))
                .originalQuantity(matchOriginal != null ? order.getOriginalQuantity().subtract(matchOriginal) : null)
                .fees(order.getFees().minus(matchFees))
                .notes(notes));

        return new OrderSplit<>(match, remainder);
    }

    /**
     * Collapses orders of the same security and kind into one order dated at midnight of the
     * first order's day.
     */
    public static <T extends Order> T merge(List<T> orders, OrderSequence sequence) {
        if (orders.size() < 2) {
            throw new InvariantViolationException("Merging requires at least two orders");
        }

        T first = orders.get(0);
        for (T order : orders) {
            if (!order.getIsin().equals(first.getIsin()) || order.getClass() != first.getClass()) {
                throw new InvariantViolationException(String.format(
                        "Cannot merge order %d (%s) with order %d (%s)",
                        order.getSequence(), order.getIsin(), first.getSequence(), first.getIsin()));
            }
        }

        Money total = orders.stream().map(Order::getTotal).reduce(Money::add).orElseThrow();
        BigDecimal quantity = orders.stream().map(Order::getQuantity).reduce(BigDecimal::add).orElseThrow();
        Fees fees = orders.stream().map(Order::getFees).reduce(Fees::plus).orElseThrow();
        BigDecimal originalQuantity = orders.stream().anyMatch(o -> o.getOriginalQuantity() != null)
                ? orders.stream().map(Order::getReportedQuantity).reduce(BigDecimal::add).orElseThrow()
                : null;
        String notes = "Merged from orders " + orders.stream()
                .map(o -> String.valueOf(o.getSequence()))
                .collect(Collectors.joining(","));

        return derive(first, b -> b
                .sequence(sequence.next())
                .timestamp(first.getTimestamp().truncatedTo(ChronoUnit.DAYS))
                .total(total)
                .quantity(quantity)
                .originalQuantity(originalQuantity)
                .fees(fees)
                .transactionId(null)
                .notes(notes));
    }

    /**
     * Restates the share quantity in present-day terms by applying every split that became
     * effective after the order was placed. Total and fees stay as they were.
     */
    public static <T extends Order> T adjustQuantity(T order, List<Split> splits, OrderSequence sequence) {
        List<BigDecimal> ratios = splits.stream()
                .filter(s -> order.getTimestamp().isBefore(s.getDateEffective()))
                .map(Split::getRatio)
                .collect(Collectors.toList());

        if (ratios.isEmpty()) {
            return order;
        }

        BigDecimal quantity = ratios.stream().reduce(order.getQuantity(), BigDecimal::multiply);
        String notes = String.format("Adjusted from order %d after applying the following split ratios: %s",
                order.getSequence(),
                ratios.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", ")));

        return derive(order, b -> b
                .sequence(sequence.next())
                .quantity(quantity)
                .originalQuantity(order.getQuantity())
                .notes(notes));
    }

    /**
     * Drops the currency conversion fee from the order, so that it no longer counts towards the
     * allowable cost (acquisitions) or the proceeds deduction (disposals).
     */
    public static <T extends Order> T excludeForexFee(T order, OrderSequence sequence) {
        if (!order.getFees().hasForex()) {
            return order;
        }

        Money forex = order.getFees().getForex();
        return derive(order, b -> b
                .sequence(sequence.next())
                .total(order.totalExcluding(forex))
                .fees(order.getFees().withoutForex())
                .notes(String.format("Adjusted from order %d after excluding forex fee of %s",
                        order.getSequence(), forex)));
    }

    @SuppressWarnings("unchecked")
    private static <T extends Order> T derive(Order source, Consumer<OrderBuilder<?, ?>> overrides) {
        OrderBuilder<?, ?> builder = source.toBuilder();
        overrides.accept(builder);
        return (T) builder.build();
    }
}
