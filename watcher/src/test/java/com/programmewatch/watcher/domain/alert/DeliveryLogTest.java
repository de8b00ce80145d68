package com.programmewatch.watcher.domain.alert;

import static com.programmewatch.watcher.test.fixtures.ProgrammeFixtures.appearedBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class DeliveryLogTest {

    @Test
    void shouldReturnNewestFirst() {
        var log = new DeliveryLog(5);
        log.append(record("a", DeliveryStatus.DELIVERED));
        log.append(record("b", DeliveryStatus.FAILED));

        assertThat(log.recent(null, 5)).extracting(DeliveryRecord::id).containsExactly("b", "a");
    }

    @Test
    void shouldEvictOldestBeyondCapacity() {
        var log = new DeliveryLog(2);
        log.append(record("a", DeliveryStatus.DELIVERED));
        log.append(record("b", DeliveryStatus.DELIVERED));
        log.append(record("c", DeliveryStatus.DELIVERED));

        assertThat(log.size()).isEqualTo(2);
        assertThat(log.recent(null, 10)).extracting(DeliveryRecord::id).containsExactly("c", "b");
    }

    @Test
    void shouldFilterByStatusAndLimit() {
        var log = new DeliveryLog(10);
        log.append(record("a", DeliveryStatus.FAILED));
        log.append(record("b", DeliveryStatus.DELIVERED));
        log.append(record("c", DeliveryStatus.FAILED));
        log.append(record("d", DeliveryStatus.FAILED));

        assertThat(log.recent(DeliveryStatus.FAILED, 2)).extracting(DeliveryRecord::id).containsExactly("d", "c");
    }

    @Test
    void shouldRejectZeroCapacity() {
        assertThatThrownBy(() -> new DeliveryLog(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static DeliveryRecord record(String id, DeliveryStatus status) {
        return DeliveryRecord.pending(id, appearedBuilder(1).build()).toBuilder()
                .attempts(1)
                .status(status)
                .build();
    }
}
