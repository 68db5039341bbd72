package uk.investir.cgt.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class CashDto {
    private LocalDate date;
    private BigDecimal amount;
}
