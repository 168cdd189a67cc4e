package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Actor;
import com.drycleaning.application.dto.MarkAllReadResponse;
import com.drycleaning.application.dto.NotificationResponse;
import com.drycleaning.application.dto.UnreadCountResponse;
import com.drycleaning.domain.entity.Notification;
import com.drycleaning.domain.entity.NotificationStatus;
import com.drycleaning.domain.repository.NotificationRepository;
import com.drycleaning.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 계정별 인앱 알림 조회/읽음 처리
 */
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final AccessControl accessControl;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public List<NotificationResponse> getNotifications(Long accountId) {
        Actor actor = accessControl.resolve(accountId);
        return notificationRepository.findByRecipientId(actor.accountId()).stream()
                .map(NotificationResponse::from)
                .toList();
    }

    public UnreadCountResponse getUnreadCount(Long accountId) {
        Actor actor = accessControl.resolve(accountId);
        return new UnreadCountResponse(
                notificationRepository.countByRecipientIdAndStatus(actor.accountId(), NotificationStatus.UNREAD));
    }

    /**
     * 다른 계정의 알림은 존재하지 않는 것으로 처리합니다.
     */
    @Transactional
    public NotificationResponse markAsRead(Long accountId, Long notificationId) {
        Actor actor = accessControl.resolve(accountId);
        Notification notification = notificationRepository.findById(notificationId)
                .filter(n -> n.isFor(actor.accountId()))
                .orElseThrow(() -> BusinessException.notFound("알림", notificationId));

        notification.markAsRead(LocalDateTime.now(clock));
        return NotificationResponse.from(notificationRepository.save(notification));
    }

    @Transactional
    public MarkAllReadResponse markAllAsRead(Long accountId) {
        Actor actor = accessControl.resolve(accountId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<Notification> unread =
                notificationRepository.findByRecipientIdAndStatus(actor.accountId(), NotificationStatus.UNREAD);
        unread.forEach(notification -> {
            notification.markAsRead(now);
            notificationRepository.save(notification);
        });
        return new MarkAllReadResponse(unread.size());
    }
}
