package org.nowstart.crossover.service;

import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.crossover.backtest.model.BacktestResult;
import org.nowstart.crossover.backtest.model.CrossoverParams;
import org.nowstart.crossover.backtest.model.GridSearchRow;
import org.nowstart.crossover.backtest.model.PricePoint;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.WindowGrid;
import org.nowstart.crossover.backtest.service.BacktestEngineFactory;
import org.nowstart.crossover.backtest.service.WindowGridSearchService;
import org.nowstart.crossover.data.dto.BacktestRequest;
import org.nowstart.crossover.data.dto.BacktestResponse;
import org.nowstart.crossover.data.dto.GridSearchRequest;
import org.nowstart.crossover.data.dto.GridSearchResponse;
import org.nowstart.crossover.data.dto.PricePointRequest;
import org.nowstart.crossover.data.exception.InvalidParameterException;
import org.nowstart.crossover.data.property.BacktestProperties;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestApiService {

    private static final String UNKNOWN_TICKER = "UNKNOWN";

    private final BacktestEngineFactory engineFactory;
    private final WindowGridSearchService gridSearchService;
    private final BacktestProperties backtestProperties;

    public BacktestResponse runBacktest(BacktestRequest request) {
        PriceSeries series = toSeries(request.prices());
        CrossoverParams params = new CrossoverParams(
                request.shortWindow(),
                request.longWindow(),
                resolveCostRate(request.costRate())
        );
        BacktestResult result = engineFactory.create(series).run(params);
        String ticker = resolveTicker(request.ticker());
        log.info(
                "Backtest completed. ticker={}, params={}, retained={}, metrics={}",
                ticker,
                params,
                result.rows().size(),
                result.metrics()
        );
        return BacktestResponse.of(ticker, result);
    }

    public GridSearchResponse runGridSearch(GridSearchRequest request) {
        PriceSeries series = toSeries(request.prices());
        List<GridSearchRow> candidates = gridSearchService.search(
                series,
                WindowGrid.parse(request.shortWindows(), request.longWindows()),
                resolveCostRate(request.costRate()),
                request.topK() != null ? request.topK() : backtestProperties.topK(),
                backtestProperties.resolvedGridParallelism(),
                backtestProperties.gridProgressLogSeconds()
        );
        return new GridSearchResponse(resolveTicker(request.ticker()), series.size(), candidates);
    }

    private PriceSeries toSeries(List<PricePointRequest> prices) {
        List<PricePoint> points = prices.stream()
                .map(row -> new PricePoint(row.timestamp(), row.price()))
                .toList();
        try {
            return PriceSeries.of(points);
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("invalid price series: " + e.getMessage(), e);
        }
    }

    private double resolveCostRate(Double costRate) {
        return costRate != null ? costRate : CrossoverParams.DEFAULT_COST_RATE;
    }

    private String resolveTicker(String ticker) {
        return ticker == null || ticker.isBlank() ? UNKNOWN_TICKER : ticker.trim().toUpperCase(Locale.ROOT);
    }
}
