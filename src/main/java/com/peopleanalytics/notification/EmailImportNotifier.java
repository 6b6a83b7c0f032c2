package com.peopleanalytics.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
public class EmailImportNotifier implements ImportNotifier {

    private final JavaMailSender mailSender;
    private final List<String> recipients;
    private final String fromEmail;

    public EmailImportNotifier(JavaMailSender mailSender,
                               @Value("${analytics.import.notification.recipients:}") String recipients,
                               @Value("${analytics.import.notification.from:analytics@company.com}") String fromEmail) {
        this.mailSender = mailSender;
        this.recipients = Arrays.stream(recipients.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        this.fromEmail = fromEmail;
    }

    @Override
    public void notify(ImportJobEvent event) {
        log.info("Import job {} finished: status={}, rows={}, succeeded={}, failed={}, took {} ms",
                event.jobId(), event.status(), event.totalRows(), event.succeeded(), event.failed(),
                event.duration().toMillis());

        if (recipients.isEmpty()) {
            return;
        }

        try {
            SimpleMailMessage message = new SimpleMailMessage();
            message.setFrom(fromEmail);
            message.setTo(recipients.toArray(new String[0]));
            message.setSubject(buildSubject(event));
            message.setText(buildBody(event));

            mailSender.send(message);
            log.debug("Import summary for job {} sent to {} recipient(s)", event.jobId(), recipients.size());
        } catch (MailException e) {
            log.error("Failed to send import summary for job {}: {}", event.jobId(), e.getMessage(), e);
        }
    }

    List<String> getRecipients() {
        return recipients;
    }

    private String buildSubject(ImportJobEvent event) {
        return String.format("Import %s: %s", event.status().name().toLowerCase(), event.fileName());
    }

    private String buildBody(ImportJobEvent event) {
        String body = String.format("""
                Import job %s (%s) finished with status %s.

                File: %s
                Rows: %d
                Imported: %d
                Rejected: %d
                Duration: %d s
                """,
                event.jobId(),
                event.kind().getSlug(),
                event.status(),
                event.fileName(),
                event.totalRows(),
                event.succeeded(),
                event.failed(),
                event.duration().toSeconds()
        );
        if (event.errorMessage() != null) {
            body += "\nError: " + event.errorMessage() + "\n";
        }
        return body;
    }
}
