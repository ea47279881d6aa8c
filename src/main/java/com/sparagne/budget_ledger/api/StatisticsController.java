package com.sparagne.budget_ledger.api;

import com.sparagne.budget_ledger.api.dto.StatisticsResponse;
import com.sparagne.budget_ledger.statistics.StatisticsPeriod;
import com.sparagne.budget_ledger.statistics.StatisticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

import static com.sparagne.budget_ledger.api.RequestHeaders.USER_HEADER;

@RestController
@RequestMapping("/api/vaults/{vaultId}/statistics")
@RequiredArgsConstructor
public class StatisticsController {

    private final StatisticsService statisticsService;

    @GetMapping
    public ResponseEntity<StatisticsResponse> getStatistics(
            @PathVariable("vaultId") UUID vaultId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestHeader(USER_HEADER) String caller) {
        StatisticsPeriod period = StatisticsPeriod.of(from, to);
        return ResponseEntity.ok(StatisticsResponse.from(statisticsService.getStatistics(vaultId, caller, period)));
    }
}
