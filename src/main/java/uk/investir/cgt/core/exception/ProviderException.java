package uk.investir.cgt.core.exception;

/**
 * Failure inside a security data or exchange rate provider. Never escapes
 * {@link uk.investir.cgt.core.findata.FinancialData}.
 */
public class ProviderException extends InvestirException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
