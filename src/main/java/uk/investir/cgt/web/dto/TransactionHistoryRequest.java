package uk.investir.cgt.web.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Complete transaction history of an account. Missing or null lists are read as empty.
 */
@Data
public class TransactionHistoryRequest {
    private List<OrderRequest> orders = new ArrayList<>();
    private List<DividendRequest> dividends = new ArrayList<>();
    private List<CashRequest> transfers = new ArrayList<>();
    private List<CashRequest> interest = new ArrayList<>();

    public void setOrders(List<OrderRequest> orders) {
        this.orders = orders != null ? orders : new ArrayList<>();
    }

    public void setDividends(List<DividendRequest> dividends) {
        this.dividends = dividends != null ? dividends : new ArrayList<>();
    }

    public void setTransfers(List<CashRequest> transfers) {
        this.transfers = transfers != null ? transfers : new ArrayList<>();
    }

    public void setInterest(List<CashRequest> interest) {
        this.interest = interest != null ? interest : new ArrayList<>();
    }
}
