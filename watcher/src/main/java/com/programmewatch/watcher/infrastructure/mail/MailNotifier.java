package com.programmewatch.watcher.infrastructure.mail;

import com.programmewatch.watcher.application.config.WatcherProperties;
import com.programmewatch.watcher.domain.alert.Notifier;
import com.programmewatch.watcher.domain.exceptions.NotifyException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/** Plain-text alerts over SMTP. */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final WatcherProperties properties;

    @Override
    public void send(List<String> recipients, String subject, String body) {
        if (recipients == null || recipients.isEmpty()) {
            throw NotifyException.noRecipients();
        }

        var message = new SimpleMailMessage();
        var from = properties.alerts().from();
        if (from != null && !from.isBlank()) {
            message.setFrom(from);
        }
        message.setTo(recipients.toArray(String[]::new));
        message.setSubject(subject);
        message.setText(body);

        try {
            mailSender.send(message);
            log.debug("mail.sent: recipients={}, subject={}", recipients.size(), subject);
        } catch (MailException e) {
            throw NotifyException.of("SMTP delivery failed: " + e.getMessage(), e);
        }
    }
}
