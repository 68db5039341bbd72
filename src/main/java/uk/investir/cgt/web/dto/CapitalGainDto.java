package uk.investir.cgt.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class CapitalGainDto {
    private int taxYear;
    private LocalDate disposalDate;
    private String isin;
    private String ticker;
    private String name;
    private BigDecimal quantity;
    private BigDecimal cost;
    private BigDecimal proceeds;
    private BigDecimal gainLoss;
    private String identification;
}
