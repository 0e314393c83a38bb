package com.focusflow.backend.modules.notification.application;

import java.util.Optional;

import com.focusflow.backend.modules.notification.domain.Notification;
import com.focusflow.backend.modules.notification.domain.NotificationDispatchLog;
import com.focusflow.backend.modules.notification.domain.NotificationDispatchStatus;
import com.focusflow.backend.modules.notification.infrastructure.webhook.WebhookNotificationClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default {@link NotificationGateway}: the in-app inbox always, plus the chat webhook when configured.
 * Delivery counts as successful once the inbox entry is stored; a webhook failure is logged and recorded
 * in the dispatch log only.
 */
@Service
public class NotificationDispatcher implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    private static final String ERROR_WEBHOOK_FAILED = "WEBHOOK_FAILED";

    private final NotificationService notificationService;
    private final WebhookNotificationClient webhookClient;

    public NotificationDispatcher(NotificationService notificationService, WebhookNotificationClient webhookClient) {
        this.notificationService = notificationService;
        this.webhookClient = webhookClient;
    }

    @Override
    public boolean notify(NotificationMessage message) {
        Optional<Notification> stored;
        try {
            stored = notificationService.deliver(message);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Notify][{}] user={} detail={}", message.kindCode(), message.userId(), ex.getMessage(), ex);
            return false;
        }

        if (stored.isEmpty()) {
            log.debug("Notification {} for user {} already delivered", message.dedupeKey(), message.userId());
            return true;
        }

        if (webhookClient.isEnabled()) {
            forwardToWebhook(stored.get(), message);
        }
        return true;
    }

    @Override
    public boolean isDelivered(String userId, String dedupeKey) {
        try {
            return notificationService.hasDedupeKey(userId, dedupeKey);
        } catch (RuntimeException ex) {
            log.warn("Could not look up notification {} for user {}: {}", dedupeKey, userId, ex.getMessage());
            return false;
        }
    }

    private void forwardToWebhook(Notification notification, NotificationMessage message) {
        NotificationDispatchStatus status = NotificationDispatchStatus.SUCCESS;
        String errorCode = null;
        String errorMessage = null;
        try {
            webhookClient.post(message);
        } catch (RuntimeException ex) {
            // RestClientException for transport errors; anything else is a misconfigured webhook
            log.warn("[ALERT][Notify][{}] webhook user={} detail={}", message.kindCode(), message.userId(), ex.getMessage());
            status = NotificationDispatchStatus.FAILED;
            errorCode = ERROR_WEBHOOK_FAILED;
            errorMessage = ex.getMessage();
        }
        try {
            notificationService.recordDispatch(
                    notification.getId(),
                    NotificationDispatchLog.CHANNEL_WEBHOOK,
                    status,
                    errorCode,
                    errorMessage
            );
        } catch (RuntimeException ex) {
            log.warn("Could not record webhook dispatch for notification {}", notification.getId(), ex);
        }
    }
}
