package com.programmewatch.watcher.domain.cycle;

import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.T1;

import com.programmewatch.watcher.domain.alert.AlertDispatcher;
import com.programmewatch.watcher.domain.alert.AlertMessageComposer;
import com.programmewatch.watcher.domain.alert.AlertPreferences;
import com.programmewatch.watcher.domain.alert.DeliveryLog;
import com.programmewatch.watcher.domain.alert.Notifier;
import com.programmewatch.watcher.domain.alert.OperatorAlerter;
import com.programmewatch.watcher.domain.alert.RetryPolicy;
import com.programmewatch.watcher.domain.change.ChangeDetector;
import com.programmewatch.watcher.domain.programme.ProgrammeSource;
import com.programmewatch.watcher.test.fixtures.InMemorySnapshotStore;
import com.programmewatch.watcher.test.fixtures.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public abstract class MarketCycleBaseTest {

    static final String CYCLE_ID = "01HXCYCLE000000000000000000";

    @Mock
    ProgrammeSource programmeSource;

    @Mock
    Notifier notifier;

    @Mock
    OperatorAlerter operatorAlerter;

    MutableClock clock;
    InMemorySnapshotStore snapshotStore;
    MarketCycle marketCycle;
    final List<CyclePhase> phases = new ArrayList<>();

    @BeforeEach
    void setUpCycle() {
        clock = new MutableClock(T1);
        snapshotStore = new InMemorySnapshotStore();
        var preferences = AlertPreferences.builder()
                .enabled(true)
                .onAppeared(true)
                .onDisappeared(true)
                .recipients(List.of("alerts@example.com"))
                .subjectPrefix("[AWIN]")
                .build();
        var retryPolicy = RetryPolicy.builder()
                .maxAttempts(5)
                .backoffBase(Duration.ofSeconds(2))
                .backoffFactor(2.0)
                .backoffMax(Duration.ofMinutes(5))
                .build();
        var dispatcher = new AlertDispatcher(
                notifier,
                new AlertMessageComposer(preferences.subjectPrefix()),
                preferences,
                retryPolicy,
                duration -> {},
                clock,
                new DeliveryLog(100));
        marketCycle = new MarketCycle(
                programmeSource, snapshotStore, new ChangeDetector(), dispatcher, operatorAlerter, clock);
    }

    CycleReport run(String marketKey) {
        return marketCycle.run(marketKey, CYCLE_ID, phases::add);
    }
}
