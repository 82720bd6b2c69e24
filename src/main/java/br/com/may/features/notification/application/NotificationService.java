package br.com.may.features.notification.application;

import br.com.may.features.notification.domain.model.NotificationKind;

import java.util.UUID;

public interface NotificationService {

    /**
     * Create a user-facing notification unless one with the same title was created for the user
     * within the trailing window. This is a best-effort, time-windowed guard, not a strict
     * deduplication key.
     *
     * @param userId        recipient
     * @param title         notification title, also the deduplication key within the window
     * @param message       body text
     * @param kind          display kind
     * @param windowMinutes trailing window in minutes; zero or negative disables the check
     * @return {@code true} if a notification was created, {@code false} if it was suppressed
     */
    boolean notifyOnce(UUID userId, String title, String message, NotificationKind kind, int windowMinutes);
}
