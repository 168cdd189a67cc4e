package com.drycleaning.interfaces.controller;

import com.drycleaning.api.NotificationApi;
import com.drycleaning.application.dto.MarkAllReadResponse;
import com.drycleaning.application.dto.NotificationResponse;
import com.drycleaning.application.dto.UnreadCountResponse;
import com.drycleaning.application.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class NotificationController implements NotificationApi {

    private final NotificationService notificationService;

    @Override
    public List<NotificationResponse> getNotifications(Long accountId) {
        return notificationService.getNotifications(accountId);
    }

    @Override
    public UnreadCountResponse getUnreadCount(Long accountId) {
        return notificationService.getUnreadCount(accountId);
    }

    @Override
    public NotificationResponse markAsRead(Long accountId, Long notificationId) {
        return notificationService.markAsRead(accountId, notificationId);
    }

    @Override
    public MarkAllReadResponse markAllAsRead(Long accountId) {
        return notificationService.markAllAsRead(accountId);
    }
}
