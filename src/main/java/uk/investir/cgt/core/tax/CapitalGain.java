package uk.investir.cgt.core.tax;

import lombok.Value;
import uk.investir.cgt.core.model.Disposal;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One taxable event: a disposal (or part of one) and the cost allocated to it. The cost already
 * includes the disposal fees, so the gain is measured against gross proceeds.
 */
@Value
public class CapitalGain {
    Disposal disposal;
    BigDecimal cost;
    /** Date of the matched acquisition, null when the shares came out of a Section 104 pool. */
    LocalDate acquisitionDate;

    public BigDecimal getProceeds() {
        return disposal.getGrossProceeds().getAmount();
    }

    public BigDecimal getGainLoss() {
        return getProceeds().subtract(cost);
    }

    public BigDecimal getQuantity() {
        return disposal.getReportedQuantity();
    }

    public int getTaxYear() {
        return disposal.getTaxYear();
    }

    public String getIdentification() {
        if (acquisitionDate == null) {
            return "Section 104";
        }
        if (acquisitionDate.equals(disposal.getDate())) {
            return "Same day";
        }
        return "Bed & B. (" + acquisitionDate + ")";
    }
}
