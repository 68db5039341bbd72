package uk.investir.cgt.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class DividendDto {
    private LocalDate date;
    private String isin;
    private String ticker;
    private String name;
    private BigDecimal amount;
    private BigDecimal withheld;
}
