package uk.investir.cgt.core.tax;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.investir.cgt.core.exception.IncompleteRecordsException;
import uk.investir.cgt.core.exception.InvariantViolationException;
import uk.investir.cgt.core.findata.FinancialData;
import uk.investir.cgt.core.history.TransactionHistory;
import uk.investir.cgt.core.model.Acquisition;
import uk.investir.cgt.core.model.Disposal;
import uk.investir.cgt.core.model.Fees;
import uk.investir.cgt.core.model.Money;
import uk.investir.cgt.core.model.Order;
import uk.investir.cgt.core.model.SecurityInfo;
import uk.investir.cgt.core.model.Split;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaxCalculatorTest {

    private static final Currency GBP = Currency.getInstance("GBP");
    private static final Currency USD = Currency.getInstance("USD");
    private static final String SHELL = "GB00B03MLX29";
    private static final String APPLE = "US0378331005";

    @Mock
    private FinancialData financialData;

    @BeforeEach
    void setUp() {
        lenient().when(financialData.getSecurityInfo(anyString(), any(), any()))
                .thenAnswer(invocation -> SecurityInfo.unknown(invocation.getArgument(1)));
    }

    private static Acquisition buy(String isin, String timestamp, String quantity, String total, Fees fees) {
        return Acquisition.builder()
                .timestamp(parse(timestamp))
                .isin(isin)
                .name(isin.equals(APPLE) ? "Apple Inc." : "Royal Dutch Shell")
                .quantity(new BigDecimal(quantity))
                .total(Money.of(total, fees.getDefaultCurrency()))
                .fees(fees)
                .build();
    }

    private static Acquisition buy(String timestamp, String quantity, String total) {
        return buy(SHELL, timestamp, quantity, total, Fees.none(GBP));
    }

    private static Disposal sell(String isin, String timestamp, String quantity, String total, Fees fees) {
        return Disposal.builder()
                .timestamp(parse(timestamp))
                .isin(isin)
                .name(isin.equals(APPLE) ? "Apple Inc." : "Royal Dutch Shell")
                .quantity(new BigDecimal(quantity))
                .total(Money.of(total, fees.getDefaultCurrency()))
                .fees(fees)
                .build();
    }

    private static Disposal sell(String timestamp, String quantity, String total) {
        return sell(SHELL, timestamp, quantity, total, Fees.none(GBP));
    }

    private static ZonedDateTime parse(String timestamp) {
        return ZonedDateTime.parse(timestamp.length() == 10 ? timestamp + "T10:00:00Z" : timestamp);
    }

    private static Fees fees(String stampDuty, String forex, String finra) {
        return Fees.builder()
                .stampDuty(stampDuty != null ? Money.of(stampDuty, GBP) : null)
                .forex(forex != null ? Money.of(forex, GBP) : null)
                .finra(finra != null ? Money.of(finra, GBP) : null)
                .defaultCurrency(GBP)
                .build();
    }

    private TaxCalculator calculator(TaxSettings settings, Order... orders) {
        TransactionHistory history = TransactionHistory.builder().orders(List.of(orders)).build();
        return new TaxCalculator(history, financialData, settings);
    }

    private TaxCalculator calculator(Order... orders) {
        return calculator(TaxSettings.builder().build(), orders);
    }

    private static TaxSettings lenientSettings() {
        return TaxSettings.builder().strict(false).build();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual.setScale(2, RoundingMode.HALF_UP)),
                () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void testSection104PoolAcrossTwoDisposals() {
        TaxCalculator calculator = calculator(
                buy(SHELL, "2015-04-01", "1000", "4150", fees("150", null, null)),
                buy(SHELL, "2018-09-01", "500", "2130", fees("80", null, null)),
                sell(SHELL, "2023-05-01", "700", "3260", fees(null, null, "100")),
                sell(SHELL, "2024-02-01", "400", "1975", fees(null, null, "105")));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(2, gains.size());
        assertAmount("3030.67", gains.get(0).getCost());
        assertAmount("3360.00", gains.get(0).getProceeds());
        assertAmount("329.33", gains.get(0).getGainLoss());
        assertEquals("Section 104", gains.get(0).getIdentification());
        assertAmount("1779.67", gains.get(1).getCost());
        assertAmount("300.33", gains.get(1).getGainLoss());

        Section104Holding holding = calculator.getHolding(SHELL).orElseThrow();
        assertEquals(0, new BigDecimal("400").compareTo(holding.getQuantity()));
        assertAmount("1674.67", holding.getCost());
        assertEquals(Set.of(2023), calculator.getDisposalYears());
    }

    @Test
    void testBedAndBreakfastWithinThirtyDays() {
        TaxCalculator calculator = calculator(
                buy("2023-01-10", "10", "500"),
                sell("2023-06-01", "10", "1000"),
                buy("2023-07-01", "10", "800"));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(1, gains.size());
        assertAmount("200", gains.get(0).getGainLoss());
        assertEquals(LocalDate.of(2023, 7, 1), gains.get(0).getAcquisitionDate());
        assertEquals("Bed & B. (2023-07-01)", gains.get(0).getIdentification());

        Section104Holding holding = calculator.getHolding(SHELL).orElseThrow();
        assertEquals(0, BigDecimal.TEN.compareTo(holding.getQuantity()));
        assertAmount("500", holding.getCost());
    }

    @Test
    void testNoBedAndBreakfastAfterThirtyDays() {
        TaxCalculator calculator = calculator(
                buy("2023-01-10", "10", "500"),
                sell("2023-06-01", "10", "1000"),
                buy("2023-07-02", "10", "800"));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(1, gains.size());
        assertNull(gains.get(0).getAcquisitionDate());
        assertAmount("500", gains.get(0).getGainLoss());
        assertAmount("800", calculator.getHolding(SHELL).orElseThrow().getCost());
    }

    @Test
    void testSameDayTakesPriorityOverBedAndBreakfast() {
        TaxCalculator calculator = calculator(
                buy("2023-06-01T09:00:00Z", "10", "900"),
                sell("2023-06-01T14:00:00Z", "10", "1000"),
                buy("2023-06-10", "10", "700"));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(1, gains.size());
        assertEquals("Same day", gains.get(0).getIdentification());
        assertAmount("100", gains.get(0).getGainLoss());
        assertAmount("700", calculator.getHolding(SHELL).orElseThrow().getCost());
    }

    @Test
    void testSameDayOrdersAreMerged() {
        TaxCalculator calculator = calculator(
                buy("2023-06-01T09:00:00Z", "5", "500"),
                buy("2023-06-01T15:00:00Z", "5", "600"),
                sell("2023-06-01T16:00:00Z", "10", "1200"));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(1, gains.size());
        assertEquals(0, BigDecimal.TEN.compareTo(gains.get(0).getQuantity()));
        assertAmount("1100", gains.get(0).getCost());
        assertAmount("100", gains.get(0).getGainLoss());
        assertTrue(calculator.getHoldings().isEmpty());
    }

    @Test
    void testPartialMatchesSplitOrdersAndFees() {
        TaxCalculator calculator = calculator(
                buy("2022-01-01", "20", "1000"),
                sell(SHELL, "2023-06-01", "10", "1000", fees(null, null, "10")),
                buy("2023-06-15", "4", "440"),
                buy("2023-06-20", "10", "1000"));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(2, gains.size());
        assertEquals(0, new BigDecimal("4").compareTo(gains.get(0).getQuantity()));
        assertAmount("444", gains.get(0).getCost());
        assertAmount("-40", gains.get(0).getGainLoss());
        assertEquals(LocalDate.of(2023, 6, 15), gains.get(0).getAcquisitionDate());
        assertEquals(0, new BigDecimal("6").compareTo(gains.get(1).getQuantity()));
        assertAmount("606", gains.get(1).getCost());
        assertAmount("0", gains.get(1).getGainLoss());
        assertEquals(LocalDate.of(2023, 6, 20), gains.get(1).getAcquisitionDate());

        Section104Holding holding = calculator.getHolding(SHELL).orElseThrow();
        assertEquals(0, new BigDecimal("24").compareTo(holding.getQuantity()));
        assertAmount("1400", holding.getCost());
    }

    @Test
    void testShareSplitRestatesEarlierOrders() {
        Split fourForOne = new Split(ZonedDateTime.parse("2020-08-31T00:00:00Z"), new BigDecimal("4"));
        when(financialData.getSecurityInfo(eq(APPLE), any(), any()))
                .thenReturn(new SecurityInfo("Apple Inc.", List.of(fourForOne)));

        TaxCalculator calculator = calculator(
                buy(APPLE, "2020-01-10", "10", "3000", Fees.none(GBP)),
                sell(APPLE, "2020-03-01", "5", "2000", Fees.none(GBP)));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(1, gains.size());
        assertEquals(0, new BigDecimal("5").compareTo(gains.get(0).getQuantity()));
        assertAmount("1500", gains.get(0).getCost());
        assertAmount("500", gains.get(0).getGainLoss());
        assertEquals(2019, gains.get(0).getTaxYear());

        Section104Holding holding = calculator.getHolding(APPLE).orElseThrow();
        assertEquals(0, new BigDecimal("20").compareTo(holding.getQuantity()));
        assertAmount("1500", holding.getCost());
        assertAmount("75", holding.getAverageCost());
    }

    @Test
    void testForexFeesIncludedByDefault() {
        TaxCalculator calculator = calculator(
                buy(SHELL, "2022-01-01", "10", "1015", fees(null, "15", null)),
                sell(SHELL, "2023-01-01", "10", "1185", fees(null, "15", null)));

        CapitalGain gain = calculator.getCapitalGains().get(0);

        assertAmount("1030", gain.getCost());
        assertAmount("1200", gain.getProceeds());
        assertAmount("170", gain.getGainLoss());
    }

    @Test
    void testForexFeesExcluded() {
        TaxCalculator calculator = calculator(TaxSettings.builder().includeFxFees(false).build(),
                buy(SHELL, "2022-01-01", "10", "1015", fees(null, "15", null)),
                sell(SHELL, "2023-01-01", "10", "1185", fees(null, "15", null)));

        CapitalGain gain = calculator.getCapitalGains().get(0);

        assertAmount("1000", gain.getCost());
        assertAmount("1200", gain.getProceeds());
        assertAmount("200", gain.getGainLoss());
    }

    @Test
    void testDisposalWithoutAcquisitionsIsIncompleteRecords() {
        TaxCalculator calculator = calculator(sell("2023-06-01", "10", "1000"));

        IncompleteRecordsException e = assertThrows(IncompleteRecordsException.class, calculator::getCapitalGains);
        assertEquals(SHELL, e.getIsin());
        // The failure is remembered rather than recalculated.
        assertSame(e, assertThrows(IncompleteRecordsException.class, calculator::getHoldings));
    }

    @Test
    void testDisposalWithoutAcquisitionsIsSkippedWhenLenient() {
        TaxCalculator calculator = calculator(lenientSettings(), sell("2023-06-01", "10", "1000"));

        assertTrue(calculator.getCapitalGains().isEmpty());
        assertTrue(calculator.getHoldings().isEmpty());
        assertTrue(calculator.getDisposalYears().isEmpty());
    }

    @Test
    void testOversoldPoolIsAbandonedWhenLenient() {
        TaxCalculator calculator = calculator(lenientSettings(),
                buy("2022-01-01", "10", "1000"),
                sell("2022-06-01", "5", "600"),
                sell("2023-06-01", "10", "1000"),
                buy(APPLE, "2022-02-01", "3", "300", Fees.none(GBP)));

        List<CapitalGain> gains = calculator.getCapitalGains();

        assertEquals(1, gains.size());
        assertAmount("100", gains.get(0).getGainLoss());
        assertEquals(Optional.empty(), calculator.getHolding(SHELL));
        assertTrue(calculator.getHolding(APPLE).isPresent());
    }

    @Test
    void testOversoldPoolFailsWhenStrict() {
        TaxCalculator calculator = calculator(
                buy("2022-01-01", "10", "1000"),
                sell("2023-06-01", "11", "1000"));

        assertThrows(IncompleteRecordsException.class, calculator::getCapitalGains);
    }

    @Test
    void testForeignCurrencyOrder() {
        Acquisition dollars = buy(APPLE, "2022-01-01", "10", "1500", Fees.none(USD));
        Acquisition pounds = buy("2022-01-01", "10", "1000");

        assertThrows(InvariantViolationException.class,
                () -> calculator(dollars, pounds).getCapitalGains());

        TaxCalculator calculator = calculator(lenientSettings(), dollars, pounds);
        assertEquals(1, calculator.getHoldings().size());
        assertTrue(calculator.getHolding(SHELL).isPresent());
    }

    @Test
    void testCalculationRunsOnce() {
        TaxCalculator calculator = calculator(
                buy("2022-01-01", "10", "1000"),
                sell("2023-06-01", "5", "600"));

        calculator.getCapitalGains();
        calculator.getCapitalGains(2023);
        calculator.getHoldings();
        calculator.getDisposalYears();

        verify(financialData, times(2)).getSecurityInfo(anyString(), any(), any());
    }

    @Test
    void testGainsAreGroupedByTaxYearAndOrderedByDisposal() {
        TaxCalculator calculator = calculator(
                buy(SHELL, "2022-01-01", "10", "1000", Fees.none(GBP)),
                buy(APPLE, "2022-01-01", "10", "1000", Fees.none(GBP)),
                sell(SHELL, "2024-04-05", "2", "300", Fees.none(GBP)),
                sell(APPLE, "2024-03-01", "2", "400", Fees.none(GBP)),
                sell(APPLE, "2024-04-06", "2", "500", Fees.none(GBP)));

        List<CapitalGain> year2023 = calculator.getCapitalGains(2023);
        assertEquals(2, year2023.size());
        assertEquals(APPLE, year2023.get(0).getDisposal().getIsin());
        assertEquals(SHELL, year2023.get(1).getDisposal().getIsin());

        List<CapitalGain> year2024 = calculator.getCapitalGains(2024);
        assertEquals(1, year2024.size());
        assertAmount("300", year2024.get(0).getGainLoss());

        assertTrue(calculator.getCapitalGains(2022).isEmpty());
        assertEquals(List.of(2023, 2024), List.copyOf(calculator.getDisposalYears()));
        assertEquals(3, calculator.getCapitalGains().size());
    }

    @Test
    void testHoldingValueInBaseCurrency() {
        when(financialData.getSecurityPrice(eq(APPLE), anyString())).thenReturn(Optional.of(Money.of("150", USD)));
        when(financialData.convertMoney(Money.of("150", USD), GBP)).thenReturn(Optional.of(Money.of("120", GBP)));

        TaxCalculator calculator = calculator(buy(APPLE, "2022-01-01", "10", "1000", Fees.none(GBP)));

        assertEquals(Optional.of(Money.of("1200", GBP)), calculator.getHoldingValue(APPLE));
        assertEquals(Optional.empty(), calculator.getHoldingValue(SHELL));
    }

    @Test
    void testHoldingValueUnavailableWithoutPrice() {
        when(financialData.getSecurityPrice(eq(SHELL), anyString())).thenReturn(Optional.empty());

        TaxCalculator calculator = calculator(buy("2022-01-01", "10", "1000"));

        assertEquals(Optional.empty(), calculator.getHoldingValue(SHELL));
    }
}
