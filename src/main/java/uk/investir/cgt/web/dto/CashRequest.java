package uk.investir.cgt.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

/**
 * Deposit, withdrawal (negative total) or interest payment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashRequest {
    private ZonedDateTime timestamp;
    private BigDecimal total;
    private String currency;
    private String transactionId;
}
