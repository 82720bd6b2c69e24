package br.com.may.features.notification.domain.repository;

import br.com.may.features.notification.domain.model.Notification;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    /**
     * Whether the user already received a notification with this title since the given instant.
     */
    boolean existsByUserIdAndTitleAndCreatedAtGreaterThanEqual(UUID userId, String title, LocalDateTime since);

    long countByUserIdAndTitle(UUID userId, String title);

    List<Notification> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
