package uk.investir.cgt.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.investir.cgt.core.history.TransactionHistory;
import uk.investir.cgt.core.model.Transaction;
import uk.investir.cgt.core.tax.CapitalGain;
import uk.investir.cgt.core.tax.TaxCalculationService;
import uk.investir.cgt.core.tax.TaxCalculator;
import uk.investir.cgt.web.dto.CapitalGainDto;
import uk.investir.cgt.web.dto.CashDto;
import uk.investir.cgt.web.dto.DividendDto;
import uk.investir.cgt.web.dto.HoldingDto;
import uk.investir.cgt.web.dto.TransactionHistoryRequest;
import uk.investir.cgt.web.mapper.TransactionMapper;

import java.util.List;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Stateless report endpoints: every request carries the complete transaction history and gets
 * a fresh calculation.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TaxReportController {

    private final TaxCalculationService taxCalculationService;
    private final TransactionMapper mapper;

    @PostMapping("/capital-gains")
    public List<CapitalGainDto> getCapitalGains(@RequestBody TransactionHistoryRequest request,
                                                @RequestParam(required = false) Integer taxYear) {
        log.info("REST CapitalGains: {} orders, taxYear={}", request.getOrders().size(), taxYear);
        TaxCalculator calculator = taxCalculationService.createCalculator(mapper.toHistory(request));

        List<CapitalGain> gains = taxYear != null
                ? calculator.getCapitalGains(taxYear)
                : calculator.getCapitalGains();

        log.debug("REST CapitalGains: returning {} events", gains.size());
        return gains.stream().map(mapper::toDto).collect(Collectors.toList());
    }

    @PostMapping("/capital-gains/years")
    public SortedSet<Integer> getDisposalYears(@RequestBody TransactionHistoryRequest request) {
        log.info("REST DisposalYears: {} orders", request.getOrders().size());
        return taxCalculationService.createCalculator(mapper.toHistory(request)).getDisposalYears();
    }

    @PostMapping("/holdings")
    public List<HoldingDto> getHoldings(@RequestBody TransactionHistoryRequest request) {
        log.info("REST Holdings: {} orders", request.getOrders().size());
        TransactionHistory history = mapper.toHistory(request);
        TaxCalculator calculator = taxCalculationService.createCalculator(history);

        return calculator.getHoldings().stream()
                .map(h -> mapper.toDto(h,
                        history.getSecurityName(h.getIsin()).orElse(null),
                        calculator.getHoldingValue(h.getIsin()).orElse(null)))
                .collect(Collectors.toList());
    }

    @PostMapping("/dividends")
    public List<DividendDto> getDividends(@RequestBody TransactionHistoryRequest request,
                                          @RequestParam(required = false) Integer taxYear) {
        log.info("REST Dividends: {} dividends, taxYear={}", request.getDividends().size(), taxYear);
        return inTaxYear(mapper.toHistory(request).getDividends(), taxYear).stream()
                .map(mapper::toDto)
                .collect(Collectors.toList());
    }

    @PostMapping("/transfers")
    public List<CashDto> getTransfers(@RequestBody TransactionHistoryRequest request,
                                      @RequestParam(required = false) Integer taxYear) {
        log.info("REST Transfers: {} transfers, taxYear={}", request.getTransfers().size(), taxYear);
        return mapper.toCashDtos(inTaxYear(mapper.toHistory(request).getTransfers(), taxYear));
    }

    @PostMapping("/interest")
    public List<CashDto> getInterest(@RequestBody TransactionHistoryRequest request,
                                     @RequestParam(required = false) Integer taxYear) {
        log.info("REST Interest: {} payments, taxYear={}", request.getInterest().size(), taxYear);
        return mapper.toCashDtos(inTaxYear(mapper.toHistory(request).getInterest(), taxYear));
    }

    private static <T extends Transaction> List<T> inTaxYear(List<T> transactions, Integer taxYear) {
        if (taxYear == null) {
            return transactions;
        }
        return transactions.stream()
                .filter(t -> t.getTaxYear() == taxYear)
                .collect(Collectors.toList());
    }
}
