package com.programmewatch.watcher.domain.alert;

import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.T0;
import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.appearedBuilder;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.times;

import com.programmewatch.watcher.domain.exceptions.NotifyException;
import com.programmewatch.watcher.domain.exceptions.StorageException;
import com.programmewatch.watcher.domain.exceptions.UpstreamException;
import com.programmewatch.watcher.test.fixtures.MutableClock;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OperatorAlerterTest {

    private static final List<String> OPERATORS = List.of("ops@example.com");

    @Mock
    Notifier notifier;

    private MutableClock clock;
    private OperatorAlerter operatorAlerter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        operatorAlerter = new OperatorAlerter(notifier, OPERATORS, Duration.ofMinutes(60), clock);
    }

    @Test
    void shouldThrottleRepeatedAlertsWithinCooldown() {
        var failure = UpstreamException.permanentFailure("GB", "credentials rejected", null);

        operatorAlerter.upstreamFailed("GB", failure);
        clock.advance(Duration.ofMinutes(30));
        operatorAlerter.upstreamFailed("GB", failure);
        clock.advance(Duration.ofMinutes(31));
        operatorAlerter.upstreamFailed("GB", failure);

        then(notifier).should(times(2)).send(eq(OPERATORS), contains("feed failure for GB"), anyString());
    }

    @Test
    void shouldThrottleEachMarketAndTopicSeparately() {
        var failure = UpstreamException.permanentFailure("GB", "credentials rejected", null);

        operatorAlerter.upstreamFailed("GB", failure);
        operatorAlerter.upstreamFailed("DE", failure);
        operatorAlerter.storageFailed("GB", StorageException.writeFailed("GB", "/data/GB.json", null));

        then(notifier).should(times(3)).send(eq(OPERATORS), anyString(), anyString());
    }

    @Test
    void shouldReportUndeliveredAlerts() {
        var failed = DeliveryRecord.pending("d1", appearedBuilder(4).build()).toBuilder()
                .attempts(5)
                .status(DeliveryStatus.FAILED)
                .lastError("mailbox full")
                .build();

        operatorAlerter.deliveriesFailed("GB", List.of(failed));

        then(notifier).should().send(eq(OPERATORS), contains("1 programme alert(s) undelivered"),
                contains("APPEARED 4 (Merchant 4) after 5 attempts: mailbox full"));
    }

    @Test
    void shouldSwallowOperatorChannelFailures() {
        willThrow(NotifyException.of("smtp down", null)).given(notifier).send(anyList(), anyString(), anyString());

        assertThatCode(() -> operatorAlerter.upstreamFailed("GB",
                        UpstreamException.permanentFailure("GB", "forbidden", null)))
                .doesNotThrowAnyException();
    }

    @Test
    void shouldOnlyLogWithoutRecipients() {
        var silent = new OperatorAlerter(notifier, List.of(), Duration.ofMinutes(60), clock);

        silent.upstreamFailed("GB", UpstreamException.permanentFailure("GB", "forbidden", null));

        then(notifier).shouldHaveNoInteractions();
    }
}
