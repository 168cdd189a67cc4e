package com.drycleaning.api;

import com.drycleaning.application.dto.MarkAllReadResponse;
import com.drycleaning.application.dto.NotificationResponse;
import com.drycleaning.application.dto.UnreadCountResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Notification", description = "인앱 알림 API")
@RequestMapping("/api/notifications")
public interface NotificationApi {

    @Operation(summary = "내 알림 목록 조회")
    @GetMapping
    List<NotificationResponse> getNotifications(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId
    );

    @Operation(summary = "읽지 않은 알림 수")
    @GetMapping("/unread-count")
    UnreadCountResponse getUnreadCount(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId
    );

    @Operation(summary = "알림 읽음 처리")
    @PatchMapping("/{notificationId}/read")
    NotificationResponse markAsRead(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "알림 ID", required = true)
            @PathVariable @Positive(message = "알림 ID는 양수여야 합니다") Long notificationId
    );

    @Operation(summary = "전체 읽음 처리")
    @PatchMapping("/read-all")
    MarkAllReadResponse markAllAsRead(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId
    );
}
