package uk.investir.cgt.core.exception;

import lombok.Getter;

/**
 * The transaction history under-represents acquisitions for a security: a disposal has nothing
 * to be matched against, or it would drive a Section 104 pool below zero shares.
 */
@Getter
public class IncompleteRecordsException extends InvestirException {
    private final String isin;
    private final String name;

    public IncompleteRecordsException(String isin, String name) {
        super(String.format("Records appear to be incomplete for %s (%s): share quantity cannot be negative",
                name, isin));
        this.isin = isin;
        this.name = name;
    }
}
