package com.workledger.api.service;

import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.model.Notification;
import com.workledger.api.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Tells each employee touched by an extraction that their reports changed.
 * Fire-and-forget: failures are logged and never reach the job.
 */
@Service
public class ExtractionNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionNotificationService.class);

    static final String TYPE = "timesheet_extraction";
    static final String ACTION_URL = "/dashboard?tab=employee-reports";

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public ExtractionNotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    public int notifyEmployees(UUID jobId, List<TimesheetEntryDTO> entries, String extractedBy) {
        Set<String> recipients = new LinkedHashSet<>();
        for (TimesheetEntryDTO entry : entries) {
            if (entry.senderEmail() != null && !entry.senderEmail().isBlank()) {
                recipients.add(entry.senderEmail().trim().toLowerCase(Locale.ROOT));
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Notification> notifications = recipients.stream()
                .map(email -> buildNotification(email, extractedBy, now))
                .collect(Collectors.toList());

        try {
            // One batch insert for all recipients
            notificationRepository.saveAll(notifications);
            logger.info("[Extraction {}] Created {} notifications", jobId, notifications.size());
            return notifications.size();
        } catch (RuntimeException e) {
            logger.error("[Extraction {}] Failed to create extraction notifications", jobId, e);
            return 0;
        }
    }

    private Notification buildNotification(String email, String extractedBy, OffsetDateTime now) {
        Notification notification = new Notification();
        notification.setUserEmail(email);
        notification.setType(TYPE);
        notification.setTitle("Timesheet Extraction Completed");
        notification.setMessage(extractedBy
                + " has performed a timesheet extraction. Please check your reports for updates.");
        notification.setTimestamp(now);
        notification.setRead(false);
        notification.setRecipientRole("employee");
        notification.setActionUrl(ACTION_URL);
        return notification;
    }
}
