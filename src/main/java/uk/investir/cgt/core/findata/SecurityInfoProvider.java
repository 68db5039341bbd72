package uk.investir.cgt.core.findata;

import uk.investir.cgt.core.model.Money;
import uk.investir.cgt.core.model.SecurityInfo;

import java.time.ZonedDateTime;

public interface SecurityInfoProvider {

    /**
     * @param refreshDate data older than this moment should be considered stale, may be null
     * @throws uk.investir.cgt.core.exception.ProviderException if the data cannot be obtained
     */
    SecurityInfo getInfo(String isin, String name, ZonedDateTime refreshDate);

    /**
     * @throws uk.investir.cgt.core.exception.ProviderException if no price is known
     */
    Money getPrice(String isin, String name);
}
