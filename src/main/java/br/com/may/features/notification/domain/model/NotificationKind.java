package br.com.may.features.notification.domain.model;

public enum NotificationKind {
    INFO,
    SUCCESS,
    WARNING,
    ALERT
}
