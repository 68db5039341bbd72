package uk.investir.cgt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "investir")
public class TaxProperties {
    /** Abort on the first data integrity violation instead of logging it and carrying on. */
    private boolean strict = true;
    /** Count currency conversion fees as allowable costs. */
    private boolean includeFxFees = true;
    private String baseCurrency = "GBP";
    /** Absolute tolerance when cross-checking a submitted total against price and quantity. */
    private BigDecimal amountTolerance = new BigDecimal("0.01");
    /** Locally known security data, keyed by ISIN. */
    private Map<String, SecurityData> securities = new HashMap<>();
    /** Units of each currency per one unit of the base currency. */
    private Map<String, BigDecimal> exchangeRates = new HashMap<>();

    @Data
    public static class SecurityData {
        private String name;
        private BigDecimal price;
        private String currency;
        private List<SplitData> splits = new ArrayList<>();
    }

    @Data
    public static class SplitData {
        /** ISO date (midnight UTC) or ISO date-time with offset. */
        private String effective;
        private BigDecimal ratio;
    }
}
