package uk.investir.cgt.core.tax;

import lombok.Builder;
import lombok.Value;

import java.util.Currency;

/**
 * Everything besides the transaction history that a {@link TaxCalculator} result depends on.
 */
@Value
@Builder
public class TaxSettings {
    @Builder.Default
    boolean strict = true;
    @Builder.Default
    boolean includeFxFees = true;
    @Builder.Default
    Currency baseCurrency = Currency.getInstance("GBP");
}
