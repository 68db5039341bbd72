package uk.investir.cgt.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DividendRequest {
    private ZonedDateTime timestamp;
    private String isin;
    private String ticker;
    private String name;
    private BigDecimal total;
    private BigDecimal withheld;
    private String currency;
    private String transactionId;
}
