package uk.investir.cgt.core.tax;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.investir.cgt.config.TaxProperties;
import uk.investir.cgt.core.findata.FinancialData;
import uk.investir.cgt.core.history.TransactionHistory;

import java.util.Currency;

/**
 * Creates a {@link TaxCalculator} per transaction history, with settings taken from the
 * application configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxCalculationService {
    private final TaxProperties properties;
    private final FinancialData financialData;

    public TaxCalculator createCalculator(TransactionHistory history) {
        TaxSettings settings = getSettings();
        log.debug("Creating tax calculator: strict={}, includeFxFees={}, baseCurrency={}",
                settings.isStrict(), settings.isIncludeFxFees(), settings.getBaseCurrency());
        return new TaxCalculator(history, financialData, settings);
    }

    public TaxSettings getSettings() {
        return TaxSettings.builder()
                .strict(properties.isStrict())
                .includeFxFees(properties.isIncludeFxFees())
                .baseCurrency(Currency.getInstance(properties.getBaseCurrency()))
                .build();
    }
}
