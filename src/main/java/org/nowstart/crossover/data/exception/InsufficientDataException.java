package org.nowstart.crossover.data.exception;

public class InsufficientDataException extends BacktestException {

    public InsufficientDataException(String message) {
        super("insufficient_data", message);
    }

}
