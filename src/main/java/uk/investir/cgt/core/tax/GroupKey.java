package uk.investir.cgt.core.tax;

import lombok.Value;
import uk.investir.cgt.core.model.OrderDirection;

import java.time.LocalDate;

@Value
class GroupKey {
    String isin;
    LocalDate date;
    OrderDirection direction;
}
