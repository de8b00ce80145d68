package com.programmewatch.watcher.domain.alert;

import java.util.List;

/**
 * Port to the mail transport. May be called several times for the same logical
 * message; implementations must not assume exactly-once delivery.
 *
 * @throws com.programmewatch.watcher.domain.exceptions.NotifyException when the
 *         message could not be handed to the transport
 */
public interface Notifier {

    void send(List<String> recipients, String subject, String body);
}
