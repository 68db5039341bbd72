package uk.investir.cgt.core.exception;

/**
 * Root of all errors raised while building a transaction history or computing capital gains.
 */
public class InvestirException extends RuntimeException {

    public InvestirException(String message) {
        super(message);
    }

    public InvestirException(String message, Throwable cause) {
        super(message, cause);
    }
}
