package com.programmewatch.watcher.domain.alert;

import com.programmewatch.watcher.domain.exceptions.NotifyException;
import com.programmewatch.watcher.domain.exceptions.StorageException;
import com.programmewatch.watcher.domain.exceptions.UpstreamException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Operator channel, separate from programme-change alerts. Mails about rejected
 * upstream credentials, storage failures and exhausted deliveries, at most once
 * per market and topic within the cooldown. Never throws.
 */
@Slf4j
public class OperatorAlerter {

    private final Notifier notifier;
    private final List<String> recipients;
    private final Duration cooldown;
    private final Clock clock;
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();

    public OperatorAlerter(Notifier notifier, List<String> recipients, Duration cooldown, Clock clock) {
        this.notifier = notifier;
        this.recipients = recipients == null ? List.of() : List.copyOf(recipients);
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public void upstreamFailed(String marketKey, UpstreamException failure) {
        var now = clock.instant();
        send(marketKey + ":upstream",
                "[Operator] Programme feed failure for " + marketKey,
                "Fetching programmes failed for " + marketKey + "\n"
                        + "Kind: " + failure.getKind() + "\n"
                        + "Error: " + failure.getMessage() + "\n"
                        + "Time: " + now + "\n",
                now);
    }

    public void storageFailed(String marketKey, StorageException failure) {
        var now = clock.instant();
        send(marketKey + ":storage",
                "[Operator] Snapshot storage failure for " + marketKey,
                "Snapshot storage failed for " + marketKey + "; the next cycle repeats the same comparison.\n"
                        + "Error: " + failure.getMessage() + "\n"
                        + "Time: " + now + "\n",
                now);
    }

    public void deliveriesFailed(String marketKey, List<DeliveryRecord> failed) {
        if (failed.isEmpty()) {
            return;
        }
        var now = clock.instant();
        var lines = failed.stream()
                .map(r -> r.change().kind() + " " + r.change().programmeId() + " (" + r.change().displayName()
                        + ") after " + r.attempts() + " attempts: " + r.lastError())
                .collect(Collectors.joining("\n"));
        send(marketKey + ":delivery",
                "[Operator] " + failed.size() + " programme alert(s) undelivered for " + marketKey,
                "These changes were recorded but their alerts could not be delivered:\n" + lines + "\n"
                        + "Time: " + now + "\n",
                now);
    }

    private void send(String topic, String subject, String body, Instant now) {
        if (recipients.isEmpty()) {
            log.warn("operator.alert: topic={}, subject={} (no operator recipients configured)", topic, subject);
            return;
        }
        var previous = lastSent.get(topic);
        if (previous != null && now.isBefore(previous.plus(cooldown))) {
            log.debug("operator.alert.throttled: topic={}, last_sent={}", topic, previous);
            return;
        }
        lastSent.put(topic, now);
        try {
            notifier.send(recipients, subject, body);
            log.info("operator.alert.sent: topic={}", topic);
        } catch (NotifyException e) {
            log.error("operator.alert.failed: topic={}, error={}", topic, e.getMessage());
        }
    }
}
