package uk.investir.cgt.core.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

/**
 * Share split (or consolidation, for ratios below one) taking effect at a given moment.
 */
@Value
public class Split {
    ZonedDateTime dateEffective;
    BigDecimal ratio;
}
