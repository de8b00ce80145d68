package com.programmewatch.watcher.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "watcher")
public record WatcherProperties(
        @NotNull Duration interval,
        @NotNull Duration initialDelay,
        @NotEmpty List<@NotBlank @Pattern(regexp = "\\s*[A-Za-z0-9_-]+\\s*") String> markets,
        @NotBlank String storagePath,
        @NotNull Duration shutdownGrace,
        @NotNull @Valid Dispatch dispatch,
        @NotNull @Valid Alerts alerts,
        @NotNull @Valid Operator operator,
        @NotNull @Valid DeliveryLog deliveryLog) {

    public record Dispatch(
            @Min(1) int maxAttempts,
            @NotNull Duration backoffBase,
            @DecimalMin("1.0") double backoffFactor,
            @NotNull Duration backoffMax) {}

    public record Alerts(
            boolean enabled,
            boolean onAppeared,
            boolean onDisappeared,
            List<String> recipients,
            String from,
            String subjectPrefix) {}

    public record Operator(List<String> recipients, @NotNull Duration cooldown) {}

    public record DeliveryLog(@Min(1) int capacity) {}

    @AssertTrue(message = "interval must be positive")
    public boolean isIntervalPositive() {
        return interval == null || (!interval.isNegative() && !interval.isZero());
    }

    /** Configured markets, upper-cased and de-duplicated in configuration order. */
    public List<String> marketKeys() {
        return markets.stream()
                .map(String::strip)
                .map(m -> m.toUpperCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
