package uk.investir.cgt.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.time.LocalDate;
import java.time.ZonedDateTime;

@Getter
@ToString
@EqualsAndHashCode
@SuperBuilder(toBuilder = true)
public abstract class Transaction {
    @NonNull
    private final ZonedDateTime timestamp;
    @NonNull
    private final Money total;
    private final String transactionId;
    private final String notes;

    public LocalDate getDate() {
        return timestamp.toLocalDate();
    }

    public int getTaxYear() {
        return TaxYears.of(getDate());
    }
}
