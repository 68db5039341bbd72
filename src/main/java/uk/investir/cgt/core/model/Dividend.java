package uk.investir.cgt.core.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class Dividend extends Transaction {
    @NonNull
    private final String isin;
    private final String ticker;
    private final String name;
    /** Tax withheld at source, if any. */
    private final Money withheld;
}
