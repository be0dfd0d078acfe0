package org.nowstart.crossover.backtest.service;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.ReturnsRow;
import org.nowstart.crossover.backtest.model.SignalRow;
import org.nowstart.crossover.data.exception.InsufficientDataException;
import org.nowstart.crossover.data.exception.InvalidParameterException;
import org.nowstart.crossover.data.exception.PriceDomainException;
import org.springframework.stereotype.Service;

@Service
public class ReturnsSimulator {

    public List<ReturnsRow> simulate(List<SignalRow> retained, PriceSeries series, double costRate) {
        if (retained == null || retained.isEmpty()) {
            throw new InsufficientDataException("no rows remain after the warm-up period");
        }
        if (!Double.isFinite(costRate) || costRate < 0.0) {
            throw new InvalidParameterException("cost rate must be a finite value >= 0, got: " + costRate);
        }

        List<ReturnsRow> out = new ArrayList<>(retained.size());
        double wealth = 1.0;
        double buyAndHoldWealth = 1.0;
        SignalRow previous = null;
        for (SignalRow row : retained) {
            if (!row.retained()) {
                throw new IllegalArgumentException("row " + row.index() + " has undefined averages or position change");
            }

            double priceReturn = priceReturn(series, row.index());
            double strategyReturn = 0.0;
            double transactionCost = 0.0;
            // The first retained row has no retained predecessor: no position held, no cost charged,
            // and the buy-and-hold benchmark is bought at its price.
            if (previous != null) {
                strategyReturn = previous.signal() * priceReturn;
                transactionCost = Math.abs(previous.positionChange()) * costRate;
                buyAndHoldWealth *= 1.0 + priceReturn;
            }
            double netReturn = strategyReturn - transactionCost;

            wealth *= 1.0 + netReturn;

            out.add(new ReturnsRow(
                    row.timestamp(),
                    row.price(),
                    row.shortMa(),
                    row.longMa(),
                    row.signal(),
                    row.positionChange(),
                    priceReturn,
                    strategyReturn,
                    transactionCost,
                    netReturn,
                    wealth - 1.0,
                    buyAndHoldWealth - 1.0
            ));
            previous = row;
        }
        return List.copyOf(out);
    }

    double priceReturn(PriceSeries series, int index) {
        if (index < 1) {
            throw new IllegalArgumentException("price return needs a previous row, index=" + index);
        }
        double previousPrice = series.price(index - 1);
        if (previousPrice <= 0.0) {
            throw new PriceDomainException(
                    "non-positive price " + previousPrice + " at " + series.timestamp(index - 1) + " cannot be used as a return base");
        }
        return (series.price(index) - previousPrice) / previousPrice;
    }
}
