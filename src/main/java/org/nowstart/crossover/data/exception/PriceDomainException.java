package org.nowstart.crossover.data.exception;

public class PriceDomainException extends BacktestException {

    public PriceDomainException(String message) {
        super("price_domain_error", message);
    }

}
