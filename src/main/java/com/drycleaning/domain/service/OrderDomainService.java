package com.drycleaning.domain.service;

import com.drycleaning.domain.entity.*;
import com.drycleaning.domain.repository.*;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문 도메인 서비스
 *
 * 책임:
 * - 주문 생성 검증 (가격 → 수량 → 빈 주문 → 일정 순서)
 * - 상태 전이와 상태 이력 기록
 * - 주문 항목 추가/삭제와 총액 재계산
 *
 * 주의:
 * - 권한 검사, 포인트 적립, 이벤트 발행은 상위 OrderLifecycleService에서 조율
 * - 상태/항목 변경 대상 주문은 호출자가 잠금 조회(findByIdForUpdate)한 것이어야 함
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderDomainService {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final OrderStatusHistoryRepository statusHistoryRepository;
    private final ServicePriceRepository servicePriceRepository;
    private final ItemRepository itemRepository;
    private final CleaningServiceRepository cleaningServiceRepository;
    private final OrderNumberGenerator orderNumberGenerator;

    /**
     * 주문을 생성합니다.
     *
     * @throws BusinessException PRICING_NOT_FOUND, INVALID_QUANTITY, EMPTY_ORDER, INVALID_SCHEDULE
     */
    @Transactional
    public Order createOrder(Long shopId, Long customerId, Long createdBy, OrderDetails details,
                             List<OrderLine> lines, LocalDateTime now) {
        List<ServicePrice> prices = resolvePrices(shopId, lines);
        lines.forEach(line -> validateQuantity(line.quantity()));
        if (lines.isEmpty()) {
            throw new BusinessException(ErrorKind.EMPTY_ORDER);
        }
        validateSchedule(details, now);

        String orderNumber = orderNumberGenerator.next(shopId, now.getYear());
        Order order = orderRepository.save(new Order(shopId, customerId, orderNumber, createdBy, details, now));

        List<OrderItem> items = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            items.add(newOrderItem(order.getId(), prices.get(i), lines.get(i), now));
        }
        List<OrderItem> savedItems = orderItemRepository.saveAll(items);

        order.recalculateTotal(savedItems, now);
        statusHistoryRepository.save(new OrderStatusHistory(
                order.getId(), null, OrderStatus.RECEIVED, createdBy, "주문 접수", now));

        log.info("주문 생성: orderId={}, orderNumber={}, items={}, total={}",
                order.getId(), orderNumber, savedItems.size(), order.getTotalAmount());
        return order;
    }

    /**
     * 상태를 변경하고 이력을 남깁니다.
     *
     * @return 변경 전 상태
     * @throws BusinessException INVALID_TRANSITION
     */
    @Transactional
    public OrderStatus changeStatus(Order order, OrderStatus target, Long changedBy, String note,
                                    LocalDateTime now) {
        OrderStatus previous = order.changeStatus(target, now);
        statusHistoryRepository.save(new OrderStatusHistory(
                order.getId(), previous, target, changedBy, note, now));
        orderRepository.save(order);

        log.info("주문 상태 변경: orderId={}, {} → {}", order.getId(), previous, target);
        return previous;
    }

    /**
     * 주문 항목을 추가하고 총액을 다시 계산합니다.
     *
     * @throws BusinessException INVALID_TRANSITION, PRICING_NOT_FOUND, INVALID_QUANTITY
     */
    @Transactional
    public OrderItem addItem(Order order, OrderLine line, LocalDateTime now) {
        order.ensureItemsModifiable();
        ServicePrice price = resolvePrice(order.getShopId(), line);
        validateQuantity(line.quantity());

        OrderItem item = orderItemRepository.save(newOrderItem(order.getId(), price, line, now));
        order.recalculateTotal(orderItemRepository.findByOrderId(order.getId()), now);
        orderRepository.save(order);
        return item;
    }

    /**
     * 주문 항목을 삭제하고 총액을 다시 계산합니다.
     * 마지막 항목은 삭제할 수 없습니다.
     *
     * @throws BusinessException INVALID_TRANSITION, NOT_FOUND, EMPTY_ORDER
     */
    @Transactional
    public void removeItem(Order order, Long orderItemId, LocalDateTime now) {
        order.ensureItemsModifiable();
        List<OrderItem> items = orderItemRepository.findByOrderId(order.getId());
        OrderItem target = items.stream()
                .filter(item -> item.getId().equals(orderItemId))
                .findFirst()
                .orElseThrow(() -> BusinessException.notFound("주문 항목", orderItemId));
        if (items.size() == 1) {
            throw new BusinessException(ErrorKind.EMPTY_ORDER, "주문의 마지막 항목은 삭제할 수 없습니다");
        }

        orderItemRepository.delete(target);
        List<OrderItem> remaining = items.stream()
                .filter(item -> !item.getId().equals(orderItemId))
                .toList();
        order.recalculateTotal(remaining, now);
        orderRepository.save(order);
    }

    /**
     * 취소된 주문을 항목, 상태 이력과 함께 삭제합니다.
     */
    @Transactional
    public void deleteOrder(Order order) {
        if (order.getStatus() != OrderStatus.CANCELLED) {
            throw new BusinessException(ErrorKind.INVALID_TRANSITION,
                    "취소된 주문만 삭제할 수 있습니다: " + order.getStatus());
        }
        orderItemRepository.deleteByOrderId(order.getId());
        statusHistoryRepository.deleteByOrderId(order.getId());
        orderRepository.delete(order);
        log.info("주문 삭제: orderId={}, orderNumber={}", order.getId(), order.getOrderNumber());
    }

    private List<ServicePrice> resolvePrices(Long shopId, List<OrderLine> lines) {
        return lines.stream()
                .map(line -> resolvePrice(shopId, line))
                .toList();
    }

    private ServicePrice resolvePrice(Long shopId, OrderLine line) {
        return servicePriceRepository.findOrderable(shopId, line.itemId(), line.serviceId())
                .orElseThrow(() -> new BusinessException(ErrorKind.PRICING_NOT_FOUND,
                        "가격이 등록되지 않은 품목/서비스입니다: itemId=" + line.itemId()
                                + ", serviceId=" + line.serviceId()));
    }

    private void validateQuantity(int quantity) {
        if (quantity < 1) {
            throw new BusinessException(ErrorKind.INVALID_QUANTITY, "수량은 1개 이상이어야 합니다: " + quantity);
        }
    }

    private void validateSchedule(OrderDetails details, LocalDateTime now) {
        LocalDateTime pickupAt = details.pickupAt();
        LocalDateTime deliveryAt = details.deliveryAt();
        if (pickupAt == null || deliveryAt == null) {
            throw new BusinessException(ErrorKind.INVALID_SCHEDULE, "픽업/배송 일시는 필수입니다");
        }
        if (!pickupAt.isAfter(now) || !deliveryAt.isAfter(now)) {
            throw new BusinessException(ErrorKind.INVALID_SCHEDULE, "픽업/배송 일시는 현재 이후여야 합니다");
        }
        if (pickupAt.isAfter(deliveryAt)) {
            throw new BusinessException(ErrorKind.INVALID_SCHEDULE, "픽업 일시는 배송 일시보다 늦을 수 없습니다");
        }
    }

    private OrderItem newOrderItem(Long orderId, ServicePrice price, OrderLine line, LocalDateTime now) {
        Item item = itemRepository.getByIdOrThrow(price.getItemId());
        CleaningService service = cleaningServiceRepository.getByIdOrThrow(price.getServiceId());
        return new OrderItem(orderId, price, item.getName(), service.getName(), line.quantity(), line.notes(), now);
    }
}
