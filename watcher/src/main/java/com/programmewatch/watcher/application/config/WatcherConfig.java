package com.programmewatch.watcher.application.config;

import com.programmewatch.common.json.JacksonConfig;
import com.programmewatch.watcher.domain.alert.AlertDispatcher;
import com.programmewatch.watcher.domain.alert.AlertMessageComposer;
import com.programmewatch.watcher.domain.alert.AlertPreferences;
import com.programmewatch.watcher.domain.alert.DeliveryLog;
import com.programmewatch.watcher.domain.alert.Notifier;
import com.programmewatch.watcher.domain.alert.OperatorAlerter;
import com.programmewatch.watcher.domain.alert.RetryPolicy;
import com.programmewatch.watcher.domain.alert.Sleeper;
import com.programmewatch.watcher.domain.change.ChangeDetector;
import com.programmewatch.watcher.domain.cycle.MarketCycle;
import com.programmewatch.watcher.domain.programme.ProgrammeSource;
import com.programmewatch.watcher.domain.snapshot.SnapshotStore;
import com.programmewatch.watcher.infrastructure.file.FileSnapshotStore;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the domain services from the validated properties; nothing below this
 * point reads configuration or the environment itself.
 */
@Configuration
@EnableConfigurationProperties({WatcherProperties.class, AwinProperties.class})
public class WatcherConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SnapshotStore snapshotStore(WatcherProperties properties) {
        return new FileSnapshotStore(Path.of(properties.storagePath()), JacksonConfig.createObjectMapper());
    }

    @Bean
    public AlertPreferences alertPreferences(WatcherProperties properties) {
        var alerts = properties.alerts();
        if (alerts.enabled() && (alerts.recipients() == null || alerts.recipients().isEmpty())) {
            throw new IllegalStateException("watcher.alerts.recipients must be set when alerts are enabled");
        }
        return AlertPreferences.builder()
                .enabled(alerts.enabled())
                .onAppeared(alerts.onAppeared())
                .onDisappeared(alerts.onDisappeared())
                .recipients(alerts.recipients())
                .subjectPrefix(alerts.subjectPrefix())
                .build();
    }

    @Bean
    public RetryPolicy retryPolicy(WatcherProperties properties) {
        var dispatch = properties.dispatch();
        return RetryPolicy.builder()
                .maxAttempts(dispatch.maxAttempts())
                .backoffBase(dispatch.backoffBase())
                .backoffFactor(dispatch.backoffFactor())
                .backoffMax(dispatch.backoffMax())
                .build();
    }

    @Bean
    public DeliveryLog deliveryLog(WatcherProperties properties) {
        return new DeliveryLog(properties.deliveryLog().capacity());
    }

    @Bean
    public AlertDispatcher alertDispatcher(
            Notifier notifier,
            AlertPreferences alertPreferences,
            RetryPolicy retryPolicy,
            Clock clock,
            DeliveryLog deliveryLog) {
        return new AlertDispatcher(
                notifier,
                new AlertMessageComposer(alertPreferences.subjectPrefix()),
                alertPreferences,
                retryPolicy,
                Sleeper.threadSleep(),
                clock,
                deliveryLog);
    }

    @Bean
    public OperatorAlerter operatorAlerter(Notifier notifier, WatcherProperties properties, Clock clock) {
        var operator = properties.operator();
        return new OperatorAlerter(notifier, operator.recipients(), operator.cooldown(), clock);
    }

    @Bean
    public MarketCycle marketCycle(
            ProgrammeSource programmeSource,
            SnapshotStore snapshotStore,
            ChangeDetector changeDetector,
            AlertDispatcher alertDispatcher,
            OperatorAlerter operatorAlerter,
            Clock clock) {
        return new MarketCycle(programmeSource, snapshotStore, changeDetector, alertDispatcher, operatorAlerter, clock);
    }
}
