package uk.investir.cgt.core.tax;

import uk.investir.cgt.core.model.Acquisition;
import uk.investir.cgt.core.model.Disposal;

import java.time.LocalDate;

/**
 * Share identification rules applied ahead of the Section 104 pool, in declaration order.
 */
enum MatchingRule {
    SAME_DAY {
        @Override
        boolean matches(Acquisition acquisition, Disposal disposal) {
            return acquisition.getDate().equals(disposal.getDate());
        }
    },
    BED_AND_BREAKFAST {
        @Override
        boolean matches(Acquisition acquisition, Disposal disposal) {
            LocalDate acquired = acquisition.getDate();
            LocalDate disposed = disposal.getDate();
            return acquired.isAfter(disposed) && !acquired.isAfter(disposed.plusDays(THIRTY_DAYS));
        }
    };

    private static final int THIRTY_DAYS = 30;

    abstract boolean matches(Acquisition acquisition, Disposal disposal);
}
