package org.nowstart.crossover.data.exception;

import lombok.Getter;

@Getter
public abstract class BacktestException extends RuntimeException {

    private final String code;

    protected BacktestException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected BacktestException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

}
