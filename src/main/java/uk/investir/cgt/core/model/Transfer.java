package uk.investir.cgt.core.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Cash moved in (positive total) or out (negative total) of the account.
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
@SuperBuilder(toBuilder = true)
public class Transfer extends Transaction {

    public boolean isDeposit() {
        return getTotal().isPositive();
    }
}
