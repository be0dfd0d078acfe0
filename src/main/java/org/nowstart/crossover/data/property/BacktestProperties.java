package org.nowstart.crossover.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "crossover.backtest")
public record BacktestProperties(
        // 기동 시 CSV 백테스트 실행 여부
        @DefaultValue("false") boolean enabled,
        // 가격 CSV 경로 (timestamp,price 또는 Date,...,Adj Close)
        @DefaultValue("") String csvPath,
        // 로그에 표시할 종목 코드
        @NotBlank @DefaultValue("UNKNOWN") String ticker,
        // 단기 이동평균 기간
        @Positive @DefaultValue("50") int shortWindow,
        // 장기 이동평균 기간
        @Positive @DefaultValue("200") int longWindow,
        // 포지션 변경 단위당 거래비용 비율(예: 0.001 = 0.1%)
        @DecimalMin("0") @DefaultValue("0.001") double costRate,
        // 기간 조합 그리드 탐색 실행 여부
        @DefaultValue("false") boolean gridEnabled,
        // 단기 기간 탐색 범위(start:end:step)
        @NotBlank @DefaultValue("10:50:10") String gridShortWindows,
        // 장기 기간 탐색 범위(start:end:step)
        @NotBlank @DefaultValue("100:200:50") String gridLongWindows,
        // 상위 후보 개수
        @Positive @DefaultValue("5") int topK,
        // 그리드 탐색 병렬도(0 이하이면 CPU 수)
        @DefaultValue("0") int gridParallelism,
        // 그리드 진행률 로그 주기(초)
        @Positive @DefaultValue("5") int gridProgressLogSeconds
) {

    public int resolvedGridParallelism() {
        return gridParallelism > 0 ? gridParallelism : Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
