package org.nowstart.crossover.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.nowstart.crossover.data.dto.BacktestRequest;
import org.nowstart.crossover.data.dto.BacktestResponse;
import org.nowstart.crossover.data.dto.GridSearchRequest;
import org.nowstart.crossover.data.dto.GridSearchResponse;
import org.nowstart.crossover.service.BacktestApiService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/backtests")
@Tag(name = "Backtest", description = "이동평균 크로스오버 백테스트 실행 및 기간 조합 탐색 API")
public class BacktestController {

    private final BacktestApiService backtestApiService;

    public BacktestController(BacktestApiService backtestApiService) {
        this.backtestApiService = backtestApiService;
    }

    @PostMapping
    @Operation(summary = "백테스트 실행", description = "가격 시계열과 단기/장기 이동평균 기간으로 백테스트를 실행하고 성과 지표와 차트 데이터를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "실행 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패 또는 잘못된 파라미터"),
            @ApiResponse(responseCode = "422", description = "데이터 부족 또는 0 이하 가격")
    })
    public BacktestResponse runBacktest(@RequestBody @Valid BacktestRequest request) {
        return backtestApiService.runBacktest(request);
    }

    @PostMapping("/grid")
    @Operation(summary = "기간 조합 탐색", description = "단기/장기 기간 범위의 모든 조합을 병렬로 백테스트하고 샤프 비율 순 상위 후보를 반환합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "탐색 성공"),
            @ApiResponse(responseCode = "400", description = "요청 검증 실패 또는 잘못된 범위")
    })
    public GridSearchResponse runGridSearch(@RequestBody @Valid GridSearchRequest request) {
        return backtestApiService.runGridSearch(request);
    }
}
