package com.programmewatch.watcher.domain.alert;

import com.programmewatch.watcher.domain.change.ChangeKind;
import java.util.List;
import lombok.Builder;

@Builder
public record AlertPreferences(
        boolean enabled,
        boolean onAppeared,
        boolean onDisappeared,
        List<String> recipients,
        String subjectPrefix) {

    public AlertPreferences {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        subjectPrefix = subjectPrefix == null ? "" : subjectPrefix.strip();
    }

    public boolean allows(ChangeKind kind) {
        if (!enabled) {
            return false;
        }
        return switch (kind) {
            case APPEARED -> onAppeared;
            case DISAPPEARED -> onDisappeared;
        };
    }
}
