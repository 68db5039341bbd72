package uk.investir.cgt.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import uk.investir.cgt.core.model.OrderDirection;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {
    private OrderDirection direction;
    private ZonedDateTime timestamp;
    private String isin;
    private String ticker;
    private String name;
    private BigDecimal quantity;
    /** Optional unit price, used to cross-check the total. */
    private BigDecimal price;
    /** Total cost (BUY) or net proceeds (SELL), fees included. */
    private BigDecimal total;
    private String currency; // Optional, defaults to the base currency
    private FeesRequest fees;
    private String transactionId;
    private String notes;
}
