package uk.investir.cgt.core.model;

import java.time.LocalDate;
import java.time.Month;

/**
 * UK tax years run from 6 April to 5 April and are identified by the calendar year they start in.
 */
public final class TaxYears {
    private static final int START_DAY = 6;
    private static final int END_DAY = 5;

    private TaxYears() {
    }

    public static int of(LocalDate date) {
        LocalDate start = LocalDate.of(date.getYear(), Month.APRIL, START_DAY);
        return date.isBefore(start) ? date.getYear() - 1 : date.getYear();
    }

    public static LocalDate start(int taxYear) {
        return LocalDate.of(taxYear, Month.APRIL, START_DAY);
    }

    public static LocalDate end(int taxYear) {
        return LocalDate.of(taxYear + 1, Month.APRIL, END_DAY);
    }
}
