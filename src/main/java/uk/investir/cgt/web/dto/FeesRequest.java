package uk.investir.cgt.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeesRequest {
    private BigDecimal stampDuty;
    private BigDecimal forex;
    private BigDecimal finra;
    private BigDecimal sec;
}
