package uk.investir.cgt.core.exception;

public class DataNotFoundException extends ProviderException {

    public DataNotFoundException(String message) {
        super(message);
    }
}
