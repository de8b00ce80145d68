package com.programmewatch.watcher.application.controller.market;

import com.programmewatch.watcher.application.controller.mapper.WatcherResponseMapper;
import com.programmewatch.watcher.application.scheduler.PollScheduler;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator view of the per-market polling state. */
@RestController
@RequestMapping("/api/v1/markets")
@RequiredArgsConstructor
public class MarketController {

    private final PollScheduler pollScheduler;
    private final WatcherResponseMapper mapper;

    @GetMapping
    public List<MarketStatusResponse> listMarkets() {
        return pollScheduler.statuses().stream().map(mapper::toResponse).toList();
    }

    @GetMapping("/{marketKey}")
    public MarketStatusResponse getMarket(@PathVariable String marketKey) {
        return mapper.toResponse(pollScheduler.status(marketKey));
    }

    @PostMapping("/{marketKey}/cycles")
    public CycleReportResponse runCycle(@PathVariable String marketKey) {
        return mapper.toResponse(pollScheduler.runNow(marketKey));
    }
}
