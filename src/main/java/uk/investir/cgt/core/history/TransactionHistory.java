package uk.investir.cgt.core.history;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import uk.investir.cgt.core.exception.AmbiguousTickerException;
import uk.investir.cgt.core.model.Dividend;
import uk.investir.cgt.core.model.Interest;
import uk.investir.cgt.core.model.Order;
import uk.investir.cgt.core.model.OrderSequence;
import uk.investir.cgt.core.model.Security;
import uk.investir.cgt.core.model.Transaction;
import uk.investir.cgt.core.model.Transfer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Deduplicated, timestamp-sorted record of everything that happened on an account. Orders are
 * numbered on insertion from the history's own {@link OrderSequence}.
 */
@Slf4j
public class TransactionHistory {
    private final OrderSequence sequence = new OrderSequence();
    private final List<Order> orders;
    private final List<Dividend> dividends;
    private final List<Transfer> transfers;
    private final List<Interest> interest;
    private final Map<String, Security> securities = new TreeMap<>();

    @Builder
    public TransactionHistory(Collection<? extends Order> orders,
                              Collection<Dividend> dividends,
                              Collection<Transfer> transfers,
                              Collection<Interest> interest) {
        this.orders = uniqueAndSorted(orders).stream()
                .map(o -> o.<Order>withSequence(sequence.next()))
                .collect(Collectors.toUnmodifiableList());
        this.dividends = uniqueAndSorted(dividends);
        this.transfers = uniqueAndSorted(transfers);
        this.interest = uniqueAndSorted(interest);

        this.orders.stream()
                .sorted(Comparator.comparing(o -> o.getName() != null ? o.getName() : ""))
                .forEach(o -> securities.put(o.getIsin(), new Security(o.getIsin(), o.getName())));

        log.debug("Transaction history: {} orders, {} dividends, {} transfers, {} interest payments, {} securities",
                this.orders.size(), this.dividends.size(), this.transfers.size(), this.interest.size(),
                securities.size());
    }

    public OrderSequence getSequence() {
        return sequence;
    }

    public List<Order> getOrders() {
        return orders;
    }

    public List<Dividend> getDividends() {
        return dividends;
    }

    public List<Transfer> getTransfers() {
        return transfers;
    }

    public List<Interest> getInterest() {
        return interest;
    }

    /**
     * Distinct securities traded, ordered by ISIN.
     */
    public Collection<Security> getSecurities() {
        return securities.values();
    }

    public Optional<String> getSecurityName(String isin) {
        return Optional.ofNullable(securities.get(isin)).map(Security::getName);
    }

    public Optional<String> getTickerIsin(String ticker) {
        Set<String> isins = orders.stream()
                .filter(o -> ticker.equals(o.getTicker()))
                .map(Order::getIsin)
                .collect(Collectors.toSet());

        if (isins.size() > 1) {
            throw new AmbiguousTickerException(ticker);
        }
        return isins.stream().findFirst();
    }

    private static <T extends Transaction> List<T> uniqueAndSorted(Collection<? extends T> transactions) {
        if (transactions == null) {
            return List.of();
        }
        List<T> unique = new ArrayList<>(new LinkedHashSet<T>(transactions));
        if (unique.size() < transactions.size()) {
            log.debug("Dropped {} duplicated transactions", transactions.size() - unique.size());
        }
        unique.sort(Comparator.comparing(Transaction::getTimestamp));
        return List.copyOf(unique);
    }
}
