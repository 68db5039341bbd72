package uk.investir.cgt.core.findata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.investir.cgt.core.exception.ProviderException;
import uk.investir.cgt.core.model.Money;
import uk.investir.cgt.core.model.SecurityInfo;

import java.math.BigDecimal;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Optional;

/**
 * Single entry point to security data and exchange rates. Provider failures are logged and
 * reported as missing data, they never reach the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialData {
    private final SecurityInfoProvider securityInfoProvider;
    private final ExchangeRateProvider exchangeRateProvider;

    public SecurityInfo getSecurityInfo(String isin, String name, ZonedDateTime refreshDate) {
        try {
            SecurityInfo info = securityInfoProvider.getInfo(isin, name, refreshDate);
            if (info != null) {
                return info;
            }
        } catch (ProviderException e) {
            log.warn("Failed to fetch information for {} - {}: {}", isin, name, e.getMessage());
        }
        return SecurityInfo.unknown(name);
    }

    public Optional<Money> getSecurityPrice(String isin, String name) {
        try {
            return Optional.ofNullable(securityInfoProvider.getPrice(isin, name));
        } catch (ProviderException e) {
            log.warn("Failed to fetch price for {} - {}: {}", isin, name, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<BigDecimal> getExchangeRate(Currency base, Currency quote) {
        try {
            return Optional.ofNullable(exchangeRateProvider.getRate(base, quote));
        } catch (ProviderException e) {
            log.warn("Failed to fetch exchange rate {}-{}: {}",
                    base.getCurrencyCode(), quote.getCurrencyCode(), e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Money> convertMoney(Money money, Currency currency) {
        if (money.getCurrency().equals(currency)) {
            return Optional.of(money);
        }
        return getExchangeRate(money.getCurrency(), currency)
                .map(rate -> new Money(money.getAmount().multiply(rate), currency));
    }
}
