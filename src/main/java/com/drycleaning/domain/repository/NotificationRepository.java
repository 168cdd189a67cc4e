package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.Notification;
import com.drycleaning.domain.entity.NotificationStatus;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface NotificationRepository {

    Notification save(Notification notification);

    Optional<Notification> findById(Long id);

    default Notification getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("알림", id));
    }

    List<Notification> findByRecipientId(Long recipientId);

    List<Notification> findByRecipientIdAndStatus(Long recipientId, NotificationStatus status);

    long countByRecipientIdAndStatus(Long recipientId, NotificationStatus status);
}
