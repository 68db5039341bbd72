package uk.investir.cgt.core.findata;

import java.math.BigDecimal;
import java.util.Currency;

public interface ExchangeRateProvider {

    /**
     * Units of {@code quote} per one unit of {@code base}.
     *
     * @throws uk.investir.cgt.core.exception.ProviderException if the rate is unknown
     */
    BigDecimal getRate(Currency base, Currency quote);
}
