package com.programmewatch.watcher.application.controller.market;

import com.programmewatch.watcher.domain.change.ChangeKind;
import java.time.Instant;

public record ChangeResponse(String programmeId, String programmeName, ChangeKind kind, Instant detectedAt) {}
