package com.peopleanalytics.notification;

import com.peopleanalytics.importjob.model.ImportJobKind;
import com.peopleanalytics.importjob.model.ImportJobStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailImportNotifierTest {

    @Mock
    private JavaMailSender mailSender;

    @Test
    void shouldOnlyLogWhenNoRecipientsConfigured() {
        // Arrange
        EmailImportNotifier notifier = new EmailImportNotifier(mailSender, "", "analytics@company.com");

        // Act
        notifier.notify(completedEvent());

        // Assert
        verifyNoInteractions(mailSender);
    }

    @Test
    void shouldParseCommaSeparatedRecipients() {
        // Act
        EmailImportNotifier notifier = new EmailImportNotifier(mailSender, " ops@firm.com, ,hr@firm.com ",
                "analytics@company.com");

        // Assert
        assertEquals(List.of("ops@firm.com", "hr@firm.com"), notifier.getRecipients());
    }

    @Test
    void shouldSendSummaryWithCounts() {
        // Arrange
        EmailImportNotifier notifier = new EmailImportNotifier(mailSender, "ops@firm.com", "analytics@company.com");

        // Act
        notifier.notify(completedEvent());

        // Assert
        ArgumentCaptor<SimpleMailMessage> message = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(message.capture());
        assertEquals("Import completed: entries.csv", message.getValue().getSubject());
        assertArrayEquals(new String[]{"ops@firm.com"}, message.getValue().getTo());
        assertTrue(message.getValue().getText().contains("Imported: 4"));
        assertTrue(message.getValue().getText().contains("Rejected: 1"));
    }

    @Test
    void shouldIncludeErrorOfFailedJob() {
        // Arrange
        EmailImportNotifier notifier = new EmailImportNotifier(mailSender, "ops@firm.com", "analytics@company.com");
        ImportJobEvent failed = new ImportJobEvent(UUID.randomUUID(), ImportJobKind.EMPLOYEES, ImportJobStatus.FAILED,
                "people.csv", 0, 0, 0, "Missing required columns: email", Duration.ofMillis(40));

        // Act
        notifier.notify(failed);

        // Assert
        ArgumentCaptor<SimpleMailMessage> message = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(message.capture());
        assertTrue(message.getValue().getText().contains("Error: Missing required columns: email"));
    }

    @Test
    void shouldNotPropagateMailFailures() {
        // Arrange
        EmailImportNotifier notifier = new EmailImportNotifier(mailSender, "ops@firm.com", "analytics@company.com");
        doThrow(new MailSendException("SMTP down")).when(mailSender).send(any(SimpleMailMessage.class));

        // Act & Assert
        assertDoesNotThrow(() -> notifier.notify(completedEvent()));
    }

    private static ImportJobEvent completedEvent() {
        return new ImportJobEvent(UUID.randomUUID(), ImportJobKind.TIME_ENTRIES, ImportJobStatus.COMPLETED,
                "entries.csv", 5, 4, 1, null, Duration.ofSeconds(3));
    }
}
