package org.nowstart.crossover.data.exception;

public class InvalidParameterException extends BacktestException {

    public InvalidParameterException(String message) {
        super("invalid_parameter", message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super("invalid_parameter", message, cause);
    }

}
