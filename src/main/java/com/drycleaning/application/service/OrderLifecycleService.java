package com.drycleaning.application.service;

import com.drycleaning.application.access.Actor;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.OrderCreateResponse;
import com.drycleaning.application.dto.OrderDetailResponse;
import com.drycleaning.application.dto.OrderStatusResponse;
import com.drycleaning.application.event.DomainEventPublisher;
import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderDetails;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.entity.Shop;
import com.drycleaning.domain.repository.AccountRepository;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import com.drycleaning.domain.repository.OrderItemRepository;
import com.drycleaning.domain.repository.OrderRepository;
import com.drycleaning.domain.repository.OrderStatusHistoryRepository;
import com.drycleaning.domain.repository.ShopRepository;
import com.drycleaning.domain.service.LoyaltyDomainService;
import com.drycleaning.domain.service.OrderDomainService;
import com.drycleaning.domain.service.OrderLine;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 라이프사이클 오케스트레이션 서비스
 *
 * 주문 변경 하나가 하나의 트랜잭션입니다.
 * 잠금 조회 → 권한 검사 → 도메인 변경 → (완료 시) 포인트 적립 → 이벤트 발행 순서로 진행하며,
 * 이벤트는 커밋 이후에만 전달됩니다.
 *
 * 재시도는 트랜잭션 밖의 OrderService에서 수행합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLifecycleService {

    private final ShopRepository shopRepository;
    private final AccountRepository accountRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final OrderStatusHistoryRepository statusHistoryRepository;
    private final OrderDomainService orderDomainService;
    private final LoyaltyDomainService loyaltyDomainService;
    private final DomainEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public OrderCreateResponse createOrder(Actor actor, Long shopId, Long requestedCustomerId,
                                           OrderDetails details, List<OrderLine> lines) {
        LocalDateTime now = LocalDateTime.now(clock);
        Shop shop = shopRepository.findById(shopId)
                .filter(Shop::isActive)
                .orElseThrow(() -> BusinessException.notFound("매장", shopId));

        Long customerId = resolveCustomer(actor, shop.getId(), requestedCustomerId);
        boolean newCustomer = !customerProfileRepository.existsByAccountId(customerId);
        if (newCustomer && !actor.isCustomer()) {
            actor.require(Capability.REGISTER_CUSTOMERS, shop.getId());
        }

        Order order = orderDomainService.createOrder(shop.getId(), customerId, actor.accountId(), details, lines, now);
        if (newCustomer) {
            loyaltyDomainService.ensureProfile(customerId, now);
        }

        eventPublisher.publish(OrderEvent.created(order, now));
        return OrderCreateResponse.from(order);
    }

    @Transactional
    public OrderStatusResponse changeStatus(Actor actor, Long orderId, OrderStatus target, String note) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = orderRepository.getByIdForUpdateOrThrow(orderId);
        actor.require(Capability.UPDATE_ORDERS, order.getShopId());

        OrderStatus previous = orderDomainService.changeStatus(order, target, actor.accountId(), note, now);
        int pointsEarned = 0;
        if (target == OrderStatus.COMPLETED) {
            pointsEarned = loyaltyDomainService.accrue(order, actor.accountId(), now);
        }

        eventPublisher.publish(OrderEvent.statusChanged(order, previous, pointsEarned, now));
        return new OrderStatusResponse(order.getId(), order.getStatus());
    }

    @Transactional
    public OrderDetailResponse addItem(Actor actor, Long orderId, OrderLine line) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = orderRepository.getByIdForUpdateOrThrow(orderId);
        requireItemAccess(actor, order);

        orderDomainService.addItem(order, line, now);
        return toDetail(order);
    }

    @Transactional
    public OrderDetailResponse removeItem(Actor actor, Long orderId, Long orderItemId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = orderRepository.getByIdForUpdateOrThrow(orderId);
        requireItemAccess(actor, order);

        orderDomainService.removeItem(order, orderItemId, now);
        return toDetail(order);
    }

    @Transactional
    public void deleteOrder(Actor actor, Long orderId) {
        Order order = orderRepository.getByIdForUpdateOrThrow(orderId);
        actor.require(Capability.DELETE_ORDERS, order.getShopId());
        orderDomainService.deleteOrder(order);
    }

    /**
     * 고객은 본인 주문만, 직원/점주는 TAKE_ORDERS 권한으로 다른 고객의 주문을 접수합니다.
     */
    private Long resolveCustomer(Actor actor, Long shopId, Long requestedCustomerId) {
        if (actor.isCustomer()) {
            if (requestedCustomerId != null && !actor.is(requestedCustomerId)) {
                throw new BusinessException(ErrorKind.FORBIDDEN, "다른 고객의 주문을 생성할 수 없습니다");
            }
            return actor.accountId();
        }

        actor.require(Capability.TAKE_ORDERS, shopId);
        if (requestedCustomerId == null) {
            throw new BusinessException(ErrorKind.VALIDATION_FAILED, "고객 ID는 필수입니다");
        }
        Account customer = accountRepository.getByIdOrThrow(requestedCustomerId);
        if (!customer.isCustomer()) {
            throw new BusinessException(ErrorKind.VALIDATION_FAILED, "고객 계정이 아닙니다: " + requestedCustomerId);
        }
        return customer.getId();
    }

    private void requireItemAccess(Actor actor, Order order) {
        if (order.isOwnedBy(actor.accountId())) {
            return;
        }
        actor.require(Capability.TAKE_ORDERS, order.getShopId());
    }

    private OrderDetailResponse toDetail(Order order) {
        return OrderDetailResponse.from(order,
                orderItemRepository.findByOrderId(order.getId()),
                statusHistoryRepository.findByOrderId(order.getId()));
    }
}
