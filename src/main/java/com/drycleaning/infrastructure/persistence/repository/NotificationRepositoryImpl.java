package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Notification;
import com.drycleaning.domain.entity.NotificationStatus;
import com.drycleaning.domain.repository.NotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class NotificationRepositoryImpl implements NotificationRepository {

    private final JpaNotificationRepository jpaNotificationRepository;

    @Override
    public Notification save(Notification notification) {
        return jpaNotificationRepository.save(notification);
    }

    @Override
    public Optional<Notification> findById(Long id) {
        return jpaNotificationRepository.findById(id);
    }

    @Override
    public List<Notification> findByRecipientId(Long recipientId) {
        return jpaNotificationRepository.findByRecipientIdOrderByCreatedAtDescIdDesc(recipientId);
    }

    @Override
    public List<Notification> findByRecipientIdAndStatus(Long recipientId, NotificationStatus status) {
        return jpaNotificationRepository.findByRecipientIdAndStatus(recipientId, status);
    }

    @Override
    public long countByRecipientIdAndStatus(Long recipientId, NotificationStatus status) {
        return jpaNotificationRepository.countByRecipientIdAndStatus(recipientId, status);
    }
}
