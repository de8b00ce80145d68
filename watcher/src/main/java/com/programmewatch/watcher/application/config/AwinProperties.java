package com.programmewatch.watcher.application.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "awin")
public record AwinProperties(
        @NotBlank String baseUrl,
        @NotBlank String publisherId,
        @NotBlank String token,
        @NotBlank String relationship,
        @NotNull Duration connectTimeout,
        @NotNull Duration readTimeout) {}
