package uk.investir.cgt.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class HoldingDto {
    private String isin;
    private String name;
    private BigDecimal quantity;
    private BigDecimal cost;
    private BigDecimal averageCost;
    private BigDecimal value; // Null when no live price is available
}
