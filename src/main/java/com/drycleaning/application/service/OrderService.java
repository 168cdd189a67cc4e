package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Actor;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.*;
import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.repository.OrderItemRepository;
import com.drycleaning.domain.repository.OrderRepository;
import com.drycleaning.domain.repository.OrderStatusHistoryRepository;
import com.drycleaning.infrastructure.retry.ConflictRetryExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 주문 Application Facade 서비스
 *
 * 책임:
 * - 요청 계정을 Actor로 해석
 * - 변경 작업을 충돌 재시도 실행기로 감싸기 (트랜잭션 밖)
 * - 조회 권한 검사와 DTO 변환
 *
 * 주의:
 * - 변경 로직은 OrderLifecycleService(트랜잭션)에 위임
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final AccessControl accessControl;
    private final ConflictRetryExecutor retryExecutor;
    private final OrderLifecycleService orderLifecycleService;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final OrderStatusHistoryRepository statusHistoryRepository;

    public OrderCreateResponse createOrder(Long accountId, Long shopId, OrderCreateRequest request) {
        Actor actor = accessControl.resolve(accountId);
        return retryExecutor.execute("createOrder", () -> orderLifecycleService.createOrder(
                actor, shopId, request.customerId(), request.toDetails(), request.toOrderLines()));
    }

    public OrderStatusResponse changeStatus(Long accountId, Long orderId, OrderStatusChangeRequest request) {
        Actor actor = accessControl.resolve(accountId);
        return retryExecutor.execute("changeStatus", () ->
                orderLifecycleService.changeStatus(actor, orderId, request.status(), request.note()));
    }

    public OrderDetailResponse addItem(Long accountId, Long orderId, OrderItemAddRequest request) {
        Actor actor = accessControl.resolve(accountId);
        return retryExecutor.execute("addItem", () ->
                orderLifecycleService.addItem(actor, orderId, request.toOrderLine()));
    }

    public OrderDetailResponse removeItem(Long accountId, Long orderId, Long orderItemId) {
        Actor actor = accessControl.resolve(accountId);
        return retryExecutor.execute("removeItem", () ->
                orderLifecycleService.removeItem(actor, orderId, orderItemId));
    }

    public void deleteOrder(Long accountId, Long orderId) {
        Actor actor = accessControl.resolve(accountId);
        retryExecutor.execute("deleteOrder", () -> orderLifecycleService.deleteOrder(actor, orderId));
    }

    /**
     * 주문 상세 조회
     * 주문 고객 본인 또는 매장 주문 조회 권한이 있는 경우에만 허용됩니다.
     */
    public OrderDetailResponse getOrder(Long accountId, Long orderId) {
        Actor actor = accessControl.resolve(accountId);
        Order order = orderRepository.getByIdOrThrow(orderId);
        if (!order.isOwnedBy(actor.accountId())) {
            actor.require(Capability.VIEW_SHOP_ORDERS, order.getShopId());
        }
        return OrderDetailResponse.from(order,
                orderItemRepository.findByOrderId(orderId),
                statusHistoryRepository.findByOrderId(orderId));
    }

    public List<OrderSummaryResponse> getMyOrders(Long accountId) {
        Actor actor = accessControl.resolve(accountId);
        return orderRepository.findByCustomerId(actor.accountId()).stream()
                .map(OrderSummaryResponse::from)
                .toList();
    }

    public List<OrderSummaryResponse> getShopOrders(Long accountId, Long shopId, OrderStatus status) {
        Actor actor = accessControl.resolve(accountId);
        actor.require(Capability.VIEW_SHOP_ORDERS, shopId);

        List<Order> orders = status == null
                ? orderRepository.findByShopId(shopId)
                : orderRepository.findByShopIdAndStatus(shopId, status);
        return orders.stream()
                .map(OrderSummaryResponse::from)
                .toList();
    }
}
