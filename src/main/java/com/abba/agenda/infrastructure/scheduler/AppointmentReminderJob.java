package com.abba.agenda.infrastructure.scheduler;

import com.abba.agenda.domain.service.AppointmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily reminder run. A run that is still sending when the next trigger fires is not overlapped;
 * the skipped appointments stay unflagged and are picked up by the run in progress or the next one.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "agenda.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AppointmentReminderJob {

    private final AppointmentService appointmentService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public AppointmentReminderJob(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    @Scheduled(cron = "${agenda.notification.reminder-cron:0 0 18 * * *}")
    public void sendReminders() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Reminder run skipped, previous run still in progress");
            return;
        }
        try {
            int sent = appointmentService.sendDueReminders();
            log.debug("Reminder run finished sent={}", sent);
        } catch (RuntimeException e) {
            log.error("Reminder run failed", e);
        } finally {
            running.set(false);
        }
    }
}
