package org.nowstart.crossover.data.exception;

public class BacktestStateException extends BacktestException {

    public BacktestStateException(String message) {
        super("backtest_not_run", message);
    }

}
