package uk.investir.cgt.core.findata;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.investir.cgt.config.TaxProperties;
import uk.investir.cgt.core.exception.DataNotFoundException;
import uk.investir.cgt.core.exception.ProviderException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Currency;

/**
 * Rates declared under {@code investir.exchange-rates}, quoted against the base currency. Only
 * pairs where one side is the base currency can be resolved.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredExchangeRateProvider implements ExchangeRateProvider {
    private final TaxProperties properties;

    @Override
    public BigDecimal getRate(Currency base, Currency quote) {
        Currency home = Currency.getInstance(properties.getBaseCurrency());

        if (base.equals(quote)) {
            return BigDecimal.ONE;
        }
        if (base.equals(home)) {
            return findRate(base, quote, quote);
        }
        if (quote.equals(home)) {
            return BigDecimal.ONE.divide(findRate(base, quote, base), MathContext.DECIMAL128);
        }
        throw new ProviderException(String.format(
                "Either %s or %s must be %s", base.getCurrencyCode(), quote.getCurrencyCode(), home.getCurrencyCode()));
    }

    private BigDecimal findRate(Currency base, Currency quote, Currency foreign) {
        BigDecimal rate = properties.getExchangeRates().get(foreign.getCurrencyCode());
        if (rate == null || rate.signum() == 0) {
            throw new DataNotFoundException(String.format(
                    "Exchange rate not found: %s-%s", base.getCurrencyCode(), quote.getCurrencyCode()));
        }
        return rate;
    }
}
