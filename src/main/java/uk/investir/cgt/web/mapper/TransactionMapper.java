package uk.investir.cgt.web.mapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.investir.cgt.config.TaxProperties;
import uk.investir.cgt.core.exception.CalculatedAmountException;
import uk.investir.cgt.core.exception.InvariantViolationException;
import uk.investir.cgt.core.history.TransactionHistory;
import uk.investir.cgt.core.model.Acquisition;
import uk.investir.cgt.core.model.Disposal;
import uk.investir.cgt.core.model.Dividend;
import uk.investir.cgt.core.model.Fees;
import uk.investir.cgt.core.model.Interest;
import uk.investir.cgt.core.model.Money;
import uk.investir.cgt.core.model.Order;
import uk.investir.cgt.core.model.OrderDirection;
import uk.investir.cgt.core.model.Transaction;
import uk.investir.cgt.core.model.Transfer;
import uk.investir.cgt.core.tax.CapitalGain;
import uk.investir.cgt.core.tax.Section104Holding;
import uk.investir.cgt.web.dto.CapitalGainDto;
import uk.investir.cgt.web.dto.CashDto;
import uk.investir.cgt.web.dto.CashRequest;
import uk.investir.cgt.web.dto.DividendDto;
import uk.investir.cgt.web.dto.DividendRequest;
import uk.investir.cgt.web.dto.FeesRequest;
import uk.investir.cgt.web.dto.HoldingDto;
import uk.investir.cgt.web.dto.OrderRequest;
import uk.investir.cgt.web.dto.TransactionHistoryRequest;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Currency;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts between HTTP payloads and the transaction model. Amounts are only rounded on the way
 * out.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionMapper {
    private static final int DISPLAY_SCALE = 2;

    private final TaxProperties properties;

    public TransactionHistory toHistory(TransactionHistoryRequest request) {
        return TransactionHistory.builder()
                .orders(request.getOrders().stream().map(this::toOrder).collect(Collectors.toList()))
                .dividends(request.getDividends().stream().map(this::toDividend).collect(Collectors.toList()))
                .transfers(request.getTransfers().stream()
                        .map(r -> Transfer.builder()
                                .timestamp(r.getTimestamp())
                                .total(money(r.getTotal(), r.getCurrency()))
                                .transactionId(r.getTransactionId())
                                .build())
                        .collect(Collectors.toList()))
                .interest(request.getInterest().stream()
                        .map(r -> Interest.builder()
                                .timestamp(r.getTimestamp())
                                .total(money(r.getTotal(), r.getCurrency()))
                                .transactionId(r.getTransactionId())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    public Order toOrder(OrderRequest request) {
        if (request.getDirection() == null || request.getIsin() == null || request.getTimestamp() == null) {
            throw new InvariantViolationException("Order requires direction, isin and timestamp");
        }
        if (request.getQuantity() == null || request.getQuantity().signum() <= 0) {
            throw new InvariantViolationException("Order quantity must be positive for " + request.getIsin());
        }

        Currency currency = currency(request.getCurrency());
        Money total = money(request.getTotal(), request.getCurrency());
        Fees fees = toFees(request.getFees(), currency);

        if (request.getPrice() != null) {
            checkTotal(request, fees.getTotal().getAmount());
        }

        Order.OrderBuilder<?, ?> builder = request.getDirection() == OrderDirection.BUY
                ? Acquisition.builder()
                : Disposal.builder();

        return builder
                .timestamp(request.getTimestamp())
                .total(total)
                .transactionId(request.getTransactionId())
                .notes(request.getNotes())
                .isin(request.getIsin())
                .ticker(request.getTicker())
                .name(request.getName())
                .quantity(request.getQuantity())
                .fees(fees)
                .build();
    }

    public CapitalGainDto toDto(CapitalGain capitalGain) {
        Disposal disposal = capitalGain.getDisposal();
        return CapitalGainDto.builder()
                .taxYear(capitalGain.getTaxYear())
                .disposalDate(disposal.getDate())
                .isin(disposal.getIsin())
                .ticker(disposal.getTicker())
                .name(disposal.getName())
                .quantity(capitalGain.getQuantity())
                .cost(round(capitalGain.getCost()))
                .proceeds(round(capitalGain.getProceeds()))
                .gainLoss(round(capitalGain.getGainLoss()))
                .identification(capitalGain.getIdentification())
                .build();
    }

    public HoldingDto toDto(Section104Holding holding, String name, Money value) {
        return HoldingDto.builder()
                .isin(holding.getIsin())
                .name(name)
                .quantity(holding.getQuantity())
                .cost(round(holding.getCost()))
                .averageCost(round(holding.getAverageCost()))
                .value(value != null ? round(value.getAmount()) : null)
                .build();
    }

    public DividendDto toDto(Dividend dividend) {
        return DividendDto.builder()
                .date(dividend.getDate())
                .isin(dividend.getIsin())
                .ticker(dividend.getTicker())
                .name(dividend.getName())
                .amount(round(dividend.getTotal().getAmount()))
                .withheld(dividend.getWithheld() != null ? round(dividend.getWithheld().getAmount()) : null)
                .build();
    }

    public List<CashDto> toCashDtos(List<? extends Transaction> transactions) {
        return transactions.stream()
                .map(t -> toCashDto(t.getTotal(), t.getDate()))
                .collect(Collectors.toList());
    }

    private CashDto toCashDto(Money amount, LocalDate date) {
        return CashDto.builder()
                .date(date)
                .amount(round(amount.getAmount()))
                .build();
    }

    private Dividend toDividend(DividendRequest request) {
        return Dividend.builder()
                .timestamp(request.getTimestamp())
                .total(money(request.getTotal(), request.getCurrency()))
                .transactionId(request.getTransactionId())
                .isin(request.getIsin())
                .ticker(request.getTicker())
                .name(request.getName())
                .withheld(request.getWithheld() != null ? money(request.getWithheld(), request.getCurrency()) : null)
                .build();
    }

    private Fees toFees(FeesRequest request, Currency currency) {
        if (request == null) {
            return Fees.none(currency);
        }
        return Fees.builder()
                .stampDuty(optionalMoney(request.getStampDuty(), currency))
                .forex(optionalMoney(request.getForex(), currency))
                .finra(optionalMoney(request.getFinra(), currency))
                .sec(optionalMoney(request.getSec(), currency))
                .defaultCurrency(currency)
                .build();
    }

    private void checkTotal(OrderRequest request, BigDecimal fees) {
        BigDecimal gross = request.getPrice().multiply(request.getQuantity());
        BigDecimal calculated = request.getDirection() == OrderDirection.BUY
                ? gross.add(fees)
                : gross.subtract(fees);

        if (calculated.subtract(request.getTotal()).abs().compareTo(properties.getAmountTolerance()) > 0) {
            log.warn("Order {} of {}: total {} does not match calculated {}",
                    request.getTransactionId(), request.getIsin(), request.getTotal(), calculated);
            throw new CalculatedAmountException(request.getTransactionId(), request.getTotal(), calculated);
        }
    }

    private Money money(BigDecimal amount, String currency) {
        if (amount == null) {
            throw new InvariantViolationException("Transaction amount is required");
        }
        return new Money(amount, currency(currency));
    }

    private static Money optionalMoney(BigDecimal amount, Currency currency) {
        return amount != null ? new Money(amount, currency) : null;
    }

    private Currency currency(String code) {
        return Currency.getInstance(code != null ? code : properties.getBaseCurrency());
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP);
    }
}
