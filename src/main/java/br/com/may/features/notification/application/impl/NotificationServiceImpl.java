package br.com.may.features.notification.application.impl;

import br.com.may.features.notification.application.NotificationService;
import br.com.may.features.notification.domain.model.Notification;
import br.com.may.features.notification.domain.model.NotificationKind;
import br.com.may.features.notification.domain.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationServiceImpl implements NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    @Override
    @Transactional
    public boolean notifyOnce(UUID userId, String title, String message, NotificationKind kind, int windowMinutes) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (windowMinutes > 0
                && notificationRepository.existsByUserIdAndTitleAndCreatedAtGreaterThanEqual(
                        userId, title, now.minusMinutes(windowMinutes))) {
            log.info("Notification '{}' for user {} suppressed, already sent in the last {} minutes",
                    title, userId, windowMinutes);
            return false;
        }

        Notification notification = new Notification();
        notification.setUserId(userId);
        notification.setTitle(title);
        notification.setMessage(message);
        notification.setKind(kind);
        notification.setRead(false);
        notification.setCreatedAt(now);
        notificationRepository.save(notification);

        log.debug("Notification '{}' created for user {}", title, userId);
        return true;
    }
}
