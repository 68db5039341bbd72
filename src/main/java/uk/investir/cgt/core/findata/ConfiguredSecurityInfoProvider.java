package uk.investir.cgt.core.findata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.investir.cgt.config.TaxProperties;
import uk.investir.cgt.core.exception.DataNotFoundException;
import uk.investir.cgt.core.exception.ProviderException;
import uk.investir.cgt.core.model.Money;
import uk.investir.cgt.core.model.SecurityInfo;
import uk.investir.cgt.core.model.Split;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Currency;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Security data declared under {@code investir.securities} in the application configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredSecurityInfoProvider implements SecurityInfoProvider {
    private final TaxProperties properties;

    @Override
    public SecurityInfo getInfo(String isin, String name, ZonedDateTime refreshDate) {
        TaxProperties.SecurityData data = properties.getSecurities().get(isin);
        if (data == null) {
            log.debug("No local security data for {} - {}", isin, name);
            return SecurityInfo.unknown(name);
        }

        List<Split> splits = data.getSplits().stream()
                .map(s -> new Split(parseEffective(isin, s.getEffective()), checkRatio(isin, s.getRatio())))
                .sorted(Comparator.comparing(Split::getDateEffective))
                .collect(Collectors.toList());

        return new SecurityInfo(data.getName() != null ? data.getName() : name, splits);
    }

    @Override
    public Money getPrice(String isin, String name) {
        TaxProperties.SecurityData data = properties.getSecurities().get(isin);
        if (data == null || data.getPrice() == null) {
            throw new DataNotFoundException(String.format("Price not found for %s - %s", isin, name));
        }

        String currency = data.getCurrency() != null ? data.getCurrency() : properties.getBaseCurrency();
        try {
            return new Money(data.getPrice(), Currency.getInstance(currency));
        } catch (IllegalArgumentException e) {
            throw new ProviderException(String.format("Invalid price currency '%s' for %s", currency, isin), e);
        }
    }

    private static BigDecimal checkRatio(String isin, BigDecimal ratio) {
        if (ratio == null || ratio.signum() <= 0) {
            throw new ProviderException(String.format("Invalid split ratio %s for %s", ratio, isin));
        }
        return ratio;
    }

    private static ZonedDateTime parseEffective(String isin, String value) {
        if (value == null) {
            throw new ProviderException("Split without effective date for " + isin);
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC);
            }
            return ZonedDateTime.parse(value);
        } catch (DateTimeParseException e) {
            throw new ProviderException(String.format("Invalid split date '%s' for %s", value, isin), e);
        }
    }
}
