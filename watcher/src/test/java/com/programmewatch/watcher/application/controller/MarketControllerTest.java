package com.programmewatch.watcher.application.controller;

import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.T0;
import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.T1;
import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.appearedBuilder;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.programmewatch.watcher.domain.alert.DeliveryRecord;
import com.programmewatch.watcher.domain.alert.DeliveryStatus;
import com.programmewatch.watcher.domain.cycle.CycleOutcome;
import com.programmewatch.watcher.domain.cycle.CyclePhase;
import com.programmewatch.watcher.domain.cycle.CycleReport;
import com.programmewatch.watcher.domain.cycle.MarketStatus;
import com.programmewatch.watcher.domain.exceptions.CycleInProgressException;
import com.programmewatch.watcher.domain.exceptions.UnknownMarketException;
import java.util.List;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

class MarketControllerTest extends ControllerBaseTest {

    @SneakyThrows
    @Test
    void shouldListMarketStatuses() {
        given(pollScheduler.statuses()).willReturn(List.of(
                MarketStatus.idle("GB").toBuilder()
                        .lastOutcome(CycleOutcome.COMPLETED)
                        .lastCycleId("cycle-1")
                        .lastStartedAt(T0)
                        .lastFinishedAt(T1)
                        .lastChangeCount(2)
                        .build(),
                MarketStatus.idle("DE").toBuilder()
                        .phase(CyclePhase.ABORTED)
                        .lastOutcome(CycleOutcome.ABORTED)
                        .lastError("AWIN responded 503 for market DE")
                        .consecutiveAborts(3)
                        .build()));

        mockMvc.perform(get(MARKETS_PATH))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].marketKey", is("GB")))
                .andExpect(jsonPath("$[0].phase", is("IDLE")))
                .andExpect(jsonPath("$[0].lastOutcome", is("COMPLETED")))
                .andExpect(jsonPath("$[0].lastChangeCount", is(2)))
                .andExpect(jsonPath("$[1].phase", is("ABORTED")))
                .andExpect(jsonPath("$[1].consecutiveAborts", is(3)));
    }

    @SneakyThrows
    @Test
    void shouldReturnOneMarket() {
        given(pollScheduler.status("gb")).willReturn(MarketStatus.idle("GB"));

        mockMvc.perform(get(MARKETS_PATH + "/gb"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.marketKey", is("GB")));
    }

    @SneakyThrows
    @Test
    void shouldReturn404ForUnknownMarket() {
        given(pollScheduler.status("FR")).willThrow(UnknownMarketException.of("FR"));

        mockMvc.perform(get(MARKETS_PATH + "/FR"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title", is("Market Not Found")))
                .andExpect(jsonPath("$.code", is(ErrorCodes.MARKET_NOT_FOUND)));
    }

    @SneakyThrows
    @Test
    void shouldRunCycleOnDemand() {
        var change = appearedBuilder(4).build();
        given(pollScheduler.runNow("GB")).willReturn(CycleReport.builder()
                .cycleId("cycle-2")
                .marketKey("GB")
                .outcome(CycleOutcome.COMPLETED)
                .changes(List.of(change))
                .deliveries(List.of(DeliveryRecord.pending("d1", change).toBuilder()
                        .attempts(1)
                        .status(DeliveryStatus.DELIVERED)
                        .build()))
                .committed(true)
                .startedAt(T0)
                .finishedAt(T1)
                .build());

        mockMvc.perform(post(MARKETS_PATH + "/GB/cycles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycleId", is("cycle-2")))
                .andExpect(jsonPath("$.outcome", is("COMPLETED")))
                .andExpect(jsonPath("$.committed", is(true)))
                .andExpect(jsonPath("$.changes[0].programmeId", is("4")))
                .andExpect(jsonPath("$.changes[0].kind", is("APPEARED")))
                .andExpect(jsonPath("$.deliveries[0].status", is("DELIVERED")))
                .andExpect(jsonPath("$.deliveries[0].programmeName", is("Merchant 4")));
    }

    @SneakyThrows
    @Test
    void shouldReturn409WhenCycleAlreadyRunning() {
        given(pollScheduler.runNow("GB")).willThrow(CycleInProgressException.of("GB"));

        mockMvc.perform(post(MARKETS_PATH + "/GB/cycles"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code", is(ErrorCodes.CYCLE_IN_PROGRESS)));
    }
}
