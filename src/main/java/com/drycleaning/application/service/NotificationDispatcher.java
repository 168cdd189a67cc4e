package com.drycleaning.application.service;

import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.application.event.OrderEventType;
import com.drycleaning.domain.entity.Notification;
import com.drycleaning.domain.entity.NotificationPriority;
import com.drycleaning.domain.entity.NotificationType;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.entity.Shop;
import com.drycleaning.domain.repository.NotificationRepository;
import com.drycleaning.domain.repository.ShopRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 이벤트를 인앱 알림으로 변환하여 저장합니다.
 *
 * - CREATED: 고객에게 접수 알림, 매장 점주에게 신규 주문 알림
 * - STATUS_CHANGED: 고객에게 상태 알림 (수령 대기는 HIGH 우선순위),
 *   수령 대기/완료 시 점주에게도 알림
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    private final NotificationRepository notificationRepository;
    private final ShopRepository shopRepository;
    private final Clock clock;

    @Transactional
    public List<Notification> dispatch(OrderEvent event) {
        LocalDateTime now = LocalDateTime.now(clock);
        Shop shop = shopRepository.getByIdOrThrow(event.shopId());

        List<Notification> notifications = new ArrayList<>();
        if (event.type() == OrderEventType.CREATED) {
            notifications.add(new Notification(event.customerId(), event.orderId(), event.shopId(),
                    NotificationType.ORDER_CREATED,
                    "주문이 접수되었습니다",
                    shop.getName() + "에서 주문 " + event.orderNumber() + "이(가) 접수되었습니다.",
                    NotificationPriority.NORMAL, now));
            notifications.add(new Notification(shop.getOwnerId(), event.orderId(), event.shopId(),
                    NotificationType.ORDER_CREATED,
                    "신규 주문",
                    "새 주문 " + event.orderNumber() + "이(가) 접수되었습니다.",
                    NotificationPriority.NORMAL, now));
        } else {
            notifications.add(customerStatusNotification(event, shop, now));
            if (event.newStatus() == OrderStatus.READY_FOR_PICKUP || event.newStatus() == OrderStatus.COMPLETED) {
                notifications.add(new Notification(shop.getOwnerId(), event.orderId(), event.shopId(),
                        NotificationType.ORDER_STATUS_CHANGED,
                        "주문 상태 변경",
                        "주문 " + event.orderNumber() + " 상태: " + event.oldStatus() + " → " + event.newStatus(),
                        NotificationPriority.NORMAL, now));
            }
        }

        List<Notification> saved = notifications.stream()
                .map(notificationRepository::save)
                .toList();
        log.info("알림 생성: orderId={}, type={}, count={}", event.orderId(), event.type(), saved.size());
        return saved;
    }

    private Notification customerStatusNotification(OrderEvent event, Shop shop, LocalDateTime now) {
        String orderNumber = event.orderNumber();
        return switch (event.newStatus()) {
            case READY_FOR_PICKUP -> new Notification(event.customerId(), event.orderId(), event.shopId(),
                    NotificationType.ORDER_READY,
                    "세탁물 수령 가능",
                    "주문 " + orderNumber + "의 세탁이 완료되었습니다. " + shop.getName() + "에서 수령해 주세요.",
                    NotificationPriority.HIGH, now);
            case COMPLETED -> new Notification(event.customerId(), event.orderId(), event.shopId(),
                    NotificationType.ORDER_COMPLETED,
                    "주문 완료",
                    event.pointsEarned() > 0
                            ? "주문 " + orderNumber + "이(가) 완료되었습니다. " + event.pointsEarned() + " 포인트가 적립되었습니다."
                            : "주문 " + orderNumber + "이(가) 완료되었습니다.",
                    NotificationPriority.NORMAL, now);
            case CANCELLED -> new Notification(event.customerId(), event.orderId(), event.shopId(),
                    NotificationType.ORDER_CANCELLED,
                    "주문 취소",
                    "주문 " + orderNumber + "이(가) 취소되었습니다.",
                    NotificationPriority.NORMAL, now);
            default -> new Notification(event.customerId(), event.orderId(), event.shopId(),
                    NotificationType.ORDER_STATUS_CHANGED,
                    "주문 상태 변경",
                    "주문 " + orderNumber + " 상태가 " + event.newStatus() + "(으)로 변경되었습니다.",
                    NotificationPriority.NORMAL, now);
        };
    }
}
