package com.coparent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ReminderScheduler {

    private final ReminderService reminderService;

    @Scheduled(cron = "${coparent.reminders.sweep-cron:0 * * * * *}")
    public void dispatchDueReminders() {
        try {
            int sent = reminderService.dispatchDueReminders();
            if (sent > 0) {
                log.info("Reminder sweep completed: {} sent", sent);
            }
        } catch (Exception e) {
            log.error("Reminder sweep failed", e);
        }
    }

    @Scheduled(cron = "${coparent.reminders.cleanup-cron:0 0 0 * * *}")
    public void cleanupOldReminders() {
        try {
            reminderService.cleanupOldReminders();
        } catch (Exception e) {
            log.error("Reminder cleanup failed", e);
        }
    }
}
