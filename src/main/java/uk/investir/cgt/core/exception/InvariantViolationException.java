package uk.investir.cgt.core.exception;

public class InvariantViolationException extends InvestirException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
