package com.drycleaning.application.service;

import com.drycleaning.application.access.Actor;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.OrderCreateResponse;
import com.drycleaning.application.dto.OrderStatusResponse;
import com.drycleaning.application.event.DomainEventPublisher;
import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.application.event.OrderEventType;
import com.drycleaning.domain.entity.*;
import com.drycleaning.domain.repository.*;
import com.drycleaning.domain.service.LoyaltyDomainService;
import com.drycleaning.domain.service.OrderDomainService;
import com.drycleaning.domain.service.OrderLine;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderLifecycleService 테스트")
class OrderLifecycleServiceTest {

    private static final ZoneId ZONE = ZoneId.of("Asia/Seoul");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZONE);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final Long SHOP_ID = 1L;
    private static final Long CUSTOMER_ID = 10L;
    private static final Long STAFF_ID = 3L;

    @Mock
    private ShopRepository shopRepository;

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private CustomerProfileRepository customerProfileRepository;

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private OrderItemRepository orderItemRepository;

    @Mock
    private OrderStatusHistoryRepository statusHistoryRepository;

    @Mock
    private OrderDomainService orderDomainService;

    @Mock
    private LoyaltyDomainService loyaltyDomainService;

    @Mock
    private DomainEventPublisher eventPublisher;

    private OrderLifecycleService orderLifecycleService;

    private final Actor customer = new Actor(CUSTOMER_ID, AccountRole.CUSTOMER, null, Set.of());
    private final Actor counterStaff = new Actor(STAFF_ID, AccountRole.STAFF, SHOP_ID,
            EnumSet.of(Capability.VIEW_SHOP_ORDERS, Capability.TAKE_ORDERS));
    private final Actor workshopStaff = new Actor(STAFF_ID, AccountRole.STAFF, SHOP_ID,
            EnumSet.of(Capability.VIEW_SHOP_ORDERS, Capability.UPDATE_ORDERS));

    private final OrderDetails details = new OrderDetails(null, null, null, null, null, null,
            NOW.plusDays(1), NOW.plusDays(3));
    private final List<OrderLine> lines = List.of(new OrderLine(1L, 1L, 2, null));

    @BeforeEach
    void setUp() {
        orderLifecycleService = new OrderLifecycleService(shopRepository, accountRepository, customerProfileRepository,
                orderRepository, orderItemRepository, statusHistoryRepository, orderDomainService,
                loyaltyDomainService, eventPublisher, CLOCK);
    }

    private Shop activeShop() {
        Shop shop = new Shop(1L, "행복세탁", null, null, NOW);
        shop.setId(SHOP_ID);
        return shop;
    }

    private Order order(OrderStatus... path) {
        Order order = new Order(SHOP_ID, CUSTOMER_ID, "ORD-2025-0001", STAFF_ID, details, NOW);
        order.setId(100L);
        for (OrderStatus status : path) {
            order.changeStatus(status, NOW);
        }
        return order;
    }

    @Test
    @DisplayName("고객은 본인 주문을 생성하고 생성 이벤트가 발행된다")
    void createOrder_ByCustomer() {
        // given
        when(shopRepository.findById(SHOP_ID)).thenReturn(Optional.of(activeShop()));
        when(customerProfileRepository.existsByAccountId(CUSTOMER_ID)).thenReturn(true);
        Order created = order();
        when(orderDomainService.createOrder(eq(SHOP_ID), eq(CUSTOMER_ID), eq(CUSTOMER_ID), eq(details), eq(lines), eq(NOW)))
                .thenReturn(created);

        // when
        OrderCreateResponse response = orderLifecycleService.createOrder(customer, SHOP_ID, null, details, lines);

        // then
        assertThat(response.orderNumber()).isEqualTo("ORD-2025-0001");
        ArgumentCaptor<OrderEvent> event = ArgumentCaptor.forClass(OrderEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertThat(event.getValue().type()).isEqualTo(OrderEventType.CREATED);
        verify(loyaltyDomainService, never()).ensureProfile(any(), any());
    }

    @Test
    @DisplayName("고객이 다른 고객의 주문을 생성하면 FORBIDDEN")
    void createOrder_CustomerForOther_Forbidden() {
        when(shopRepository.findById(SHOP_ID)).thenReturn(Optional.of(activeShop()));

        assertThatThrownBy(() -> orderLifecycleService.createOrder(customer, SHOP_ID, 11L, details, lines))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
        verifyNoInteractions(orderDomainService, eventPublisher);
    }

    @Test
    @DisplayName("주문 접수 권한이 없는 직원은 주문을 생성할 수 없다")
    void createOrder_StaffWithoutTakeOrders_Forbidden() {
        when(shopRepository.findById(SHOP_ID)).thenReturn(Optional.of(activeShop()));

        assertThatThrownBy(() -> orderLifecycleService.createOrder(workshopStaff, SHOP_ID, CUSTOMER_ID, details, lines))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
    }

    @Test
    @DisplayName("프로필이 없는 고객의 주문은 고객 등록 권한이 필요하다")
    void createOrder_NewCustomerWithoutRegisterPermission_Forbidden() {
        Account account = new Account("홍길동", "010-1234-5678", null, AccountRole.CUSTOMER, NOW);
        account.setId(CUSTOMER_ID);
        when(shopRepository.findById(SHOP_ID)).thenReturn(Optional.of(activeShop()));
        when(accountRepository.getByIdOrThrow(CUSTOMER_ID)).thenReturn(account);
        when(customerProfileRepository.existsByAccountId(CUSTOMER_ID)).thenReturn(false);

        assertThatThrownBy(() -> orderLifecycleService.createOrder(counterStaff, SHOP_ID, CUSTOMER_ID, details, lines))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
        verifyNoInteractions(orderDomainService);
    }

    @Test
    @DisplayName("비활성 매장에는 주문할 수 없다")
    void createOrder_InactiveShop_NotFound() {
        when(shopRepository.findById(SHOP_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orderLifecycleService.createOrder(customer, SHOP_ID, null, details, lines))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("고객은 주문 상태를 변경할 수 없다")
    void changeStatus_ByCustomer_Forbidden() {
        when(orderRepository.getByIdForUpdateOrThrow(100L)).thenReturn(order());

        assertThatThrownBy(() -> orderLifecycleService.changeStatus(customer, 100L, OrderStatus.IN_PROGRESS, null))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
        verifyNoInteractions(orderDomainService, eventPublisher);
    }

    @Test
    @DisplayName("완료 처리 시 포인트를 적립하고 적립 포인트를 이벤트에 담는다")
    void changeStatus_Completed_AccruesPoints() {
        // given
        Order order = order(OrderStatus.IN_PROGRESS, OrderStatus.READY_FOR_PICKUP);
        when(orderRepository.getByIdForUpdateOrThrow(100L)).thenReturn(order);
        when(orderDomainService.changeStatus(order, OrderStatus.COMPLETED, STAFF_ID, null, NOW))
                .thenAnswer(invocation -> order.changeStatus(OrderStatus.COMPLETED, NOW));
        when(loyaltyDomainService.accrue(order, STAFF_ID, NOW)).thenReturn(25);

        // when
        OrderStatusResponse response = orderLifecycleService.changeStatus(workshopStaff, 100L, OrderStatus.COMPLETED, null);

        // then
        assertThat(response.status()).isEqualTo(OrderStatus.COMPLETED);
        ArgumentCaptor<OrderEvent> event = ArgumentCaptor.forClass(OrderEvent.class);
        verify(eventPublisher).publish(event.capture());
        assertThat(event.getValue().oldStatus()).isEqualTo(OrderStatus.READY_FOR_PICKUP);
        assertThat(event.getValue().newStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(event.getValue().pointsEarned()).isEqualTo(25);
    }

    @Test
    @DisplayName("완료가 아닌 상태 변경은 포인트를 적립하지 않는다")
    void changeStatus_NotCompleted_NoAccrual() {
        Order order = order();
        when(orderRepository.getByIdForUpdateOrThrow(100L)).thenReturn(order);
        when(orderDomainService.changeStatus(order, OrderStatus.IN_PROGRESS, STAFF_ID, "세탁 시작", NOW))
                .thenAnswer(invocation -> order.changeStatus(OrderStatus.IN_PROGRESS, NOW));

        orderLifecycleService.changeStatus(workshopStaff, 100L, OrderStatus.IN_PROGRESS, "세탁 시작");

        verifyNoInteractions(loyaltyDomainService);
        verify(eventPublisher).publish(any(OrderEvent.class));
    }

    @Test
    @DisplayName("고객은 본인 주문에 항목을 추가할 수 있다")
    void addItem_ByOwningCustomer() {
        Order order = order();
        OrderLine line = new OrderLine(1L, 1L, 1, null);
        when(orderRepository.getByIdForUpdateOrThrow(100L)).thenReturn(order);
        when(orderItemRepository.findByOrderId(100L)).thenReturn(List.of());
        when(statusHistoryRepository.findByOrderId(100L)).thenReturn(List.of());

        orderLifecycleService.addItem(customer, 100L, line);

        verify(orderDomainService).addItem(order, line, NOW);
    }

    @Test
    @DisplayName("주문 삭제는 DELETE_ORDERS 권한이 필요하다")
    void deleteOrder_WithoutPermission_Forbidden() {
        when(orderRepository.getByIdForUpdateOrThrow(100L)).thenReturn(order(OrderStatus.CANCELLED));

        assertThatThrownBy(() -> orderLifecycleService.deleteOrder(counterStaff, 100L))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
        verify(orderDomainService, never()).deleteOrder(any());
    }
}
