package com.programmewatch.watcher.domain.alert;

import com.programmewatch.watcher.domain.change.Change;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class AlertMessageComposer {

    private final String subjectPrefix;

    public AlertMessage compose(Change change) {
        var headline = switch (change.kind()) {
            case APPEARED -> "New programme: ";
            case DISAPPEARED -> "Programme removed: ";
        };
        var subject = prefixed(headline + change.displayName());
        var body = "Market: " + change.marketKey() + "\n"
                + "Programme ID: " + change.programmeId() + "\n"
                + "Programme: " + change.displayName() + "\n"
                + "Change: " + change.kind() + "\n"
                + "Detected at: " + change.detectedAt() + "\n";
        return new AlertMessage(subject, body);
    }

    private String prefixed(String subject) {
        return subjectPrefix == null || subjectPrefix.isBlank() ? subject : subjectPrefix + " " + subject;
    }
}
