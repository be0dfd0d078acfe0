package org.nowstart.crossover.backtest.runner;

import java.nio.file.Path;
import java.util.List;
import org.nowstart.crossover.backtest.model.BacktestResult;
import org.nowstart.crossover.backtest.model.GridSearchRow;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.ReturnsRow;
import org.nowstart.crossover.backtest.model.WindowGrid;
import org.nowstart.crossover.backtest.service.BacktestEngine;
import org.nowstart.crossover.backtest.service.BacktestEngineFactory;
import org.nowstart.crossover.backtest.service.MetricsReportFormatter;
import org.nowstart.crossover.backtest.service.PriceSeriesCsvLoader;
import org.nowstart.crossover.backtest.service.WindowGridSearchService;
import org.nowstart.crossover.data.property.BacktestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class BacktestRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);
    private static final int TAIL_ROW_COUNT = 10;

    private final BacktestProperties properties;
    private final PriceSeriesCsvLoader csvLoader;
    private final BacktestEngineFactory engineFactory;
    private final WindowGridSearchService gridSearchService;
    private final MetricsReportFormatter formatter;

    public BacktestRunner(
            BacktestProperties properties,
            PriceSeriesCsvLoader csvLoader,
            BacktestEngineFactory engineFactory,
            WindowGridSearchService gridSearchService,
            MetricsReportFormatter formatter
    ) {
        this.properties = properties;
        this.csvLoader = csvLoader;
        this.engineFactory = engineFactory;
        this.gridSearchService = gridSearchService;
        this.formatter = formatter;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("crossover.backtest.enabled=false; pass --crossover.backtest.enabled=true to run");
            return;
        }
        if (properties.csvPath().isBlank()) {
            throw new IllegalStateException("crossover.backtest.csv-path must be set when the backtest is enabled");
        }

        logSection("BACKTEST START");
        log.info("[Overview] ticker={} csv={} short={} long={} costRate={}",
                properties.ticker(),
                properties.csvPath(),
                properties.shortWindow(),
                properties.longWindow(),
                formatter.formatPercent(properties.costRate()));

        PriceSeries series = csvLoader.load(Path.of(properties.csvPath()));
        log.info("[Overview] loaded {}", series);

        BacktestEngine engine = engineFactory.create(series);
        BacktestResult result = engine.run(properties.shortWindow(), properties.longWindow(), properties.costRate());

        logSection("SUMMARY");
        logSummary(result);

        if (properties.gridEnabled()) {
            logSection("GRID SEARCH");
            logGridSearch(series);
        }

        logSection("TAIL");
        logTailRows(result.rows());
        logSection("BACKTEST END");
    }

    private void logSummary(BacktestResult result) {
        log.info("[{}] range={} retained={} positionChanges={}",
                properties.ticker(),
                result.range(),
                result.rows().size(),
                result.positionChanges());
        formatter.formatReport(result.metrics())
                .lines()
                .forEach(line -> log.info("[{}] {}", properties.ticker(), line));
    }

    private void logGridSearch(PriceSeries series) {
        List<GridSearchRow> rows = gridSearchService.search(
                series,
                WindowGrid.parse(properties.gridShortWindows(), properties.gridLongWindows()),
                properties.costRate(),
                properties.topK(),
                properties.resolvedGridParallelism(),
                properties.gridProgressLogSeconds()
        );
        for (int i = 0; i < rows.size(); i++) {
            GridSearchRow row = rows.get(i);
            log.info("[Candidate {}/{}] short={} long={} sharpe={} total={} mdd={} positionChanges={}",
                    i + 1,
                    rows.size(),
                    row.params().shortWindow(),
                    row.params().longWindow(),
                    formatter.formatRatio(row.metrics().sharpeRatio()),
                    formatter.formatPercent(row.metrics().totalReturn()),
                    formatter.formatPercent(row.metrics().maxDrawdown()),
                    row.positionChanges());
        }
    }

    private void logTailRows(List<ReturnsRow> rows) {
        int start = Math.max(0, rows.size() - TAIL_ROW_COUNT);
        for (int i = start; i < rows.size(); i++) {
            ReturnsRow row = rows.get(i);
            log.info("[Backtest][TAIL] ts={} price={} signal={} net={} cum={}",
                    row.timestamp(), row.price(), row.signal(), row.netReturn(), row.cumulativeReturn());
        }
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }
}
