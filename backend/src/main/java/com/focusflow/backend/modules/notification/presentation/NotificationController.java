package com.focusflow.backend.modules.notification.presentation;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.focusflow.backend.global.error.ProblemException;
import com.focusflow.backend.modules.notification.application.NotificationService;
import com.focusflow.backend.modules.notification.application.NotificationService.NotificationFilterState;
import com.focusflow.backend.modules.notification.application.NotificationService.NotificationPageResult;
import com.focusflow.backend.modules.notification.domain.Notification;
import com.focusflow.backend.modules.notification.presentation.dto.MarkAllReadResponse;
import com.focusflow.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.focusflow.backend.modules.notification.presentation.dto.NotificationListResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 50;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Operation(summary = "사용자 알림 목록 조회")
    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestParam(name = "userId") String userId,
            @RequestParam(name = "state", defaultValue = "all") String stateParam,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        String user = requireUserId(userId);
        NotificationFilterState filter = parseState(stateParam);
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        NotificationPageResult result = notificationService.getNotifications(
                user,
                filter,
                PageRequest.of(safePage, safeSize)
        );

        List<NotificationItemResponse> items = result.notifications().stream()
                .map(this::toItemResponse)
                .toList();

        NotificationListResponse response = new NotificationListResponse(
                items,
                result.page(),
                result.size(),
                result.totalElements(),
                result.unreadCount()
        );
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "알림 읽음 처리")
    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<Void> markRead(
            @PathVariable("notificationId") UUID notificationId,
            @RequestParam(name = "userId") String userId
    ) {
        notificationService.markNotificationRead(requireUserId(userId), notificationId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "모든 알림 읽음 처리")
    @PatchMapping("/read-all")
    public ResponseEntity<MarkAllReadResponse> markAllRead(@RequestParam(name = "userId") String userId) {
        int updated = notificationService.markAllNotificationsRead(requireUserId(userId));
        return ResponseEntity.ok(new MarkAllReadResponse(updated));
    }

    private NotificationItemResponse toItemResponse(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getCreatedAt(),
                notification.getReadAt(),
                notification.getTtlAt(),
                notification.getMetadata()
        );
    }

    private static String requireUserId(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ProblemException.validation("notification.user_id_required", "userId is required");
        }
        return userId.trim();
    }

    private NotificationFilterState parseState(String value) {
        String normalized = value == null ? "all" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> NotificationFilterState.ALL;
            case "unread" -> NotificationFilterState.UNREAD;
            case "read" -> NotificationFilterState.READ;
            default -> throw ProblemException.validation("notification.invalid_state", "state must be all, unread or read");
        };
    }
}
