package uk.investir.cgt.core.model;

/**
 * Hands out increasing order numbers. Owned by a {@link uk.investir.cgt.core.history.TransactionHistory};
 * the numbers only appear in audit notes of derived orders.
 */
public class OrderSequence {
    private long last;

    public synchronized long next() {
        return ++last;
    }

    public synchronized long current() {
        return last;
    }
}
