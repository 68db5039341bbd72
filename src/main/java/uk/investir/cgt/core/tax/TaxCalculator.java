package uk.investir.cgt.core.tax;

import lombok.extern.slf4j.Slf4j;
import uk.investir.cgt.core.exception.IncompleteRecordsException;
import uk.investir.cgt.core.exception.InvariantViolationException;
import uk.investir.cgt.core.exception.InvestirException;
import uk.investir.cgt.core.findata.FinancialData;
import uk.investir.cgt.core.history.TransactionHistory;
import uk.investir.cgt.core.model.Acquisition;
import uk.investir.cgt.core.model.Disposal;
import uk.investir.cgt.core.model.Money;
import uk.investir.cgt.core.model.Order;
import uk.investir.cgt.core.model.OrderSequence;
import uk.investir.cgt.core.model.OrderSplit;
import uk.investir.cgt.core.model.Security;
import uk.investir.cgt.core.model.Split;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Computes capital gains on share disposals following HMRC share identification rules: shares
 * acquired on the same day first, then shares acquired within the following 30 days, and finally
 * the Section 104 pool.
 *
 * <p>The whole history is processed once, on the first query. The instance is then a read-only
 * view of the result; a different history needs a new calculator.
 */
@Slf4j
public class TaxCalculator {
    private final TransactionHistory history;
    private final FinancialData financialData;
    private final TaxSettings settings;
    private final OrderSequence sequence;

    private final Map<GroupKey, List<Order>> sameDayOrders = new LinkedHashMap<>();
    private final Map<String, List<Acquisition>> acquisitions = new HashMap<>();
    private final Map<String, List<Disposal>> disposals = new HashMap<>();
    private final Map<String, Section104Holding> holdings = new TreeMap<>();
    private final Map<Integer, List<CapitalGain>> capitalGains = new TreeMap<>();
    private boolean calculated;
    private InvestirException failure;

    public TaxCalculator(TransactionHistory history, FinancialData financialData, TaxSettings settings) {
        this.history = history;
        this.financialData = financialData;
        this.settings = settings;
        this.sequence = history.getSequence();
    }

    /**
     * All capital gain events, ordered by tax year, then disposal time and security.
     */
    public List<CapitalGain> getCapitalGains() {
        ensureCalculated();
        return capitalGains.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<CapitalGain> getCapitalGains(int taxYear) {
        ensureCalculated();
        return capitalGains.getOrDefault(taxYear, List.of());
    }

    public Collection<Section104Holding> getHoldings() {
        ensureCalculated();
        return Collections.unmodifiableCollection(holdings.values());
    }

    public Optional<Section104Holding> getHolding(String isin) {
        ensureCalculated();
        return Optional.ofNullable(holdings.get(isin));
    }

    public SortedSet<Integer> getDisposalYears() {
        ensureCalculated();
        return Collections.unmodifiableSortedSet(new TreeSet<>(capitalGains.keySet()));
    }

    /**
     * Current market value of a holding in the base currency, if a live price (and exchange
     * rate, for securities quoted in another currency) is available.
     */
    public Optional<Money> getHoldingValue(String isin) {
        Optional<Section104Holding> holding = getHolding(isin);
        if (holding.isEmpty()) {
            return Optional.empty();
        }

        String name = history.getSecurityName(isin).orElse("");
        return financialData.getSecurityPrice(isin, name)
                .flatMap(price -> financialData.convertMoney(price, settings.getBaseCurrency()))
                .map(price -> price.multiply(holding.get().getQuantity()));
    }

    private synchronized void ensureCalculated() {
        if (failure != null) {
            throw failure;
        }
        if (!calculated) {
            try {
                calculateCapitalGains();
            } catch (InvestirException e) {
                failure = e;
                throw e;
            }
            calculated = true;
        }
    }

    private void calculateCapitalGains() {
        log.info("Calculating capital gains for {} orders", history.getOrders().size());

        groupSameDayOrders();

        for (Security security : history.getSecurities()) {
            log.debug("Calculating capital gains for {} ({})", security.getName(), security.getIsin());

            mergeSameDayOrders(security.getIsin());
            matchShares(security.getIsin(), MatchingRule.SAME_DAY);
            matchShares(security.getIsin(), MatchingRule.BED_AND_BREAKFAST);
            processSection104Disposals(security);
        }

        // Events were collected security by security; reports list them in disposal order.
        capitalGains.replaceAll((year, events) -> events.stream()
                .sorted(Comparator.comparing((CapitalGain cg) -> cg.getDisposal().getTimestamp())
                        .thenComparing(cg -> cg.getDisposal().getIsin()))
                .collect(Collectors.toUnmodifiableList()));

        log.info("Calculated {} capital gain events across {} tax years, {} holdings remaining",
                capitalGains.values().stream().mapToInt(List::size).sum(), capitalGains.size(), holdings.size());
    }

    private void groupSameDayOrders() {
        for (Order order : history.getOrders()) {
            normalize(order).ifPresent(o -> sameDayOrders
                    .computeIfAbsent(new GroupKey(o.getIsin(), o.getDate(), o.getDirection()), k -> new ArrayList<>())
                    .add(o));
        }
    }

    private Optional<Order> normalize(Order order) {
        try {
            checkBaseCurrency(order);
        } catch (InvariantViolationException e) {
            handleViolation(e);
            return Optional.empty();
        }

        List<Split> splits = financialData.getSecurityInfo(order.getIsin(), order.getName(), order.getTimestamp())
                .getSplits();
        Order adjusted = Order.adjustQuantity(order, splits, sequence);
        if (adjusted != order) {
            log.debug("Share split adjusted order: {}", adjusted);
        }

        if (!settings.isIncludeFxFees()) {
            adjusted = Order.excludeForexFee(adjusted, sequence);
        }
        return Optional.of(adjusted);
    }

    private void checkBaseCurrency(Order order) {
        boolean foreign = Stream.concat(
                        Stream.of(order.getTotal()),
                        Stream.of(order.getFees().getStampDuty(), order.getFees().getForex(),
                                order.getFees().getFinra(), order.getFees().getSec()))
                .filter(m -> m != null)
                .anyMatch(m -> !m.getCurrency().equals(settings.getBaseCurrency()));

        if (foreign) {
            throw new InvariantViolationException(String.format(
                    "Order %d (%s on %s) is not denominated in %s",
                    order.getSequence(), order.getIsin(), order.getDate(),
                    settings.getBaseCurrency().getCurrencyCode()));
        }
    }

    private void mergeSameDayOrders(String isin) {
        sameDayOrders.entrySet().stream()
                .filter(e -> e.getKey().getIsin().equals(isin))
                .map(Map.Entry::getValue)
                .forEach(orders -> {
                    Order order = orders.get(0);
                    if (orders.size() > 1) {
                        order = Order.merge(orders, sequence);
                        log.debug("New same-day merged order: {}", order);
                    }

                    if (order instanceof Acquisition) {
                        acquisitions.computeIfAbsent(isin, k -> new ArrayList<>()).add((Acquisition) order);
                    } else if (order instanceof Disposal) {
                        disposals.computeIfAbsent(isin, k -> new ArrayList<>()).add((Disposal) order);
                    }
                });
    }

    private void matchShares(String isin, MatchingRule rule) {
        List<Acquisition> acquisits = acquisitions.computeIfAbsent(isin, k -> new ArrayList<>());
        List<Disposal> disposes = disposals.computeIfAbsent(isin, k -> new ArrayList<>());
        Set<Order> matched = Collections.newSetFromMap(new IdentityHashMap<>());

        int a = 0;
        int d = 0;

        while (d < disposes.size()) {
            if (a == acquisits.size()) {
                a = 0;
                d++;
                continue;
            }

            Acquisition acquisition = acquisits.get(a);
            Disposal disposal = disposes.get(d);

            if (matched.contains(acquisition) || !rule.matches(acquisition, disposal)) {
                a++;
                continue;
            }

            matched.add(acquisition);
            matched.add(disposal);

            int cmp = acquisition.getQuantity().compareTo(disposal.getQuantity());
            if (cmp > 0) {
                OrderSplit<Acquisition> split = Order.split(acquisition, disposal.getQuantity(), sequence);
                acquisition = split.getMatch();
                acquisits.set(a, split.getRemainder());
                a = 0;
                d++;
            } else if (cmp < 0) {
                OrderSplit<Disposal> split = Order.split(disposal, acquisition.getQuantity(), sequence);
                disposal = split.getMatch();
                disposes.set(d, split.getRemainder());
                a++;
            } else {
                a = 0;
                d++;
            }

            BigDecimal cost = acquisition.getTotal().getAmount().add(disposal.getFees().getTotal().getAmount());
            log.debug("{}: {} shares of {} disposed on {} matched with acquisition on {}",
                    rule, disposal.getQuantity(), isin, disposal.getDate(), acquisition.getDate());
            addCapitalGain(new CapitalGain(disposal, cost, acquisition.getDate()));
        }

        acquisits.removeIf(matched::contains);
        disposes.removeIf(matched::contains);
    }

    private void processSection104Disposals(Security security) {
        String isin = security.getIsin();
        List<Order> orders = new ArrayList<>(acquisitions.get(isin));
        orders.addAll(disposals.get(isin));
        orders.sort(Comparator.comparing(Order::getDate));

        for (Order order : orders) {
            Section104Holding holding = holdings.get(isin);

            if (order instanceof Acquisition) {
                BigDecimal cost = order.getTotal().getAmount();
                if (holding != null) {
                    holding.increase(order.getQuantity(), cost);
                } else {
                    holdings.put(isin, new Section104Holding(isin, order.getQuantity(), cost));
                }
            } else if (order instanceof Disposal) {
                Disposal disposal = (Disposal) order;

                if (holding == null) {
                    handleViolation(new IncompleteRecordsException(isin, security.getName()));
                    log.warn("Skipping disposal of {} shares of {} on {}", disposal.getQuantity(), isin, disposal.getDate());
                    continue;
                }

                BigDecimal allowableCost = holding.getCost()
                        .multiply(disposal.getQuantity())
                        .divide(holding.getQuantity(), MathContext.DECIMAL128);

                if (!holding.decrease(disposal.getQuantity(), allowableCost)) {
                    holdings.remove(isin);
                    handleViolation(new IncompleteRecordsException(isin, security.getName()));
                    log.warn("Abandoning Section 104 pool for {} after disposal on {}", isin, disposal.getDate());
                    return;
                }

                if (holding.isEmpty()) {
                    holdings.remove(isin);
                }

                BigDecimal cost = allowableCost.add(disposal.getFees().getTotal().getAmount());
                addCapitalGain(new CapitalGain(disposal, cost, null));
            }
        }
    }

    private void addCapitalGain(CapitalGain capitalGain) {
        capitalGains.computeIfAbsent(capitalGain.getTaxYear(), k -> new ArrayList<>()).add(capitalGain);
    }

    private void handleViolation(InvestirException e) {
        if (settings.isStrict()) {
            throw e;
        }
        log.warn(e.getMessage());
    }
}
