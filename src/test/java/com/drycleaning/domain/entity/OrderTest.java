package com.drycleaning.domain.entity;

import com.drycleaning.domain.vo.Money;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Order Entity 테스트")
class OrderTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 9, 0);

    private Order newOrder() {
        OrderDetails details = new OrderDetails(null, null, "홍길동", "010-1234-5678", null, null,
                NOW.plusDays(1), NOW.plusDays(3));
        return new Order(1L, 10L, "ORD-2025-0001", 2L, details, NOW);
    }

    @Test
    @DisplayName("주문은 RECEIVED 상태, 총액 0으로 생성된다")
    void createOrder() {
        // when
        Order order = newOrder();

        // then
        assertThat(order.getStatus()).isEqualTo(OrderStatus.RECEIVED);
        assertThat(order.getTotalAmount()).isEqualTo(Money.zero());
        assertThat(order.getPriority()).isEqualTo(OrderPriority.NORMAL);
        assertThat(order.getPickupType()).isEqualTo(PickupType.DROP_OFF);
        assertThat(order.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("픽업 일시가 없으면 INVALID_SCHEDULE 예외가 발생한다")
    void createOrder_WithoutSchedule_ThrowsException() {
        OrderDetails details = new OrderDetails(null, null, null, null, null, null, null, NOW.plusDays(1));

        assertThatThrownBy(() -> new Order(1L, 10L, "ORD-2025-0001", 2L, details, NOW))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.INVALID_SCHEDULE);
    }

    @Test
    @DisplayName("완료로 변경하면 완료 시각이 기록되고 이전 상태를 반환한다")
    void changeStatus_ToCompleted() {
        // given
        Order order = newOrder();
        order.changeStatus(OrderStatus.IN_PROGRESS, NOW);
        order.changeStatus(OrderStatus.READY_FOR_PICKUP, NOW);

        // when
        OrderStatus previous = order.changeStatus(OrderStatus.COMPLETED, NOW.plusHours(1));

        // then
        assertThat(previous).isEqualTo(OrderStatus.READY_FOR_PICKUP);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getCompletedAt()).isEqualTo(NOW.plusHours(1));
        assertThat(order.getCancelledAt()).isNull();
    }

    @Test
    @DisplayName("완료된 주문은 처리 중으로 되돌릴 수 없다")
    void changeStatus_FromCompleted_ThrowsException() {
        // given
        Order order = newOrder();
        order.changeStatus(OrderStatus.IN_PROGRESS, NOW);
        order.changeStatus(OrderStatus.READY_FOR_PICKUP, NOW);
        order.changeStatus(OrderStatus.COMPLETED, NOW);

        // when & then
        assertThatThrownBy(() -> order.changeStatus(OrderStatus.IN_PROGRESS, NOW))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.INVALID_TRANSITION);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
    }

    @Test
    @DisplayName("취소하면 취소 시각이 기록된다")
    void changeStatus_ToCancelled() {
        Order order = newOrder();

        order.changeStatus(OrderStatus.CANCELLED, NOW.plusMinutes(5));

        assertThat(order.getCancelledAt()).isEqualTo(NOW.plusMinutes(5));
    }

    @Test
    @DisplayName("수령 대기 상태에서는 항목을 변경할 수 없다")
    void ensureItemsModifiable_ReadyForPickup_ThrowsException() {
        Order order = newOrder();
        order.changeStatus(OrderStatus.IN_PROGRESS, NOW);
        order.changeStatus(OrderStatus.READY_FOR_PICKUP, NOW);

        assertThatThrownBy(order::ensureItemsModifiable)
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("총액은 항목 합계로 재계산된다")
    void recalculateTotal() {
        // given
        Order order = newOrder();
        order.setId(100L);
        ServicePrice shirtWash = servicePrice("12.50");
        ServicePrice coatDry = servicePrice("30.00");
        List<OrderItem> items = List.of(
                new OrderItem(100L, shirtWash, "셔츠", "세탁", 2, null, NOW),
                new OrderItem(100L, coatDry, "코트", "드라이", 1, null, NOW));

        // when
        order.recalculateTotal(items, NOW);

        // then
        assertThat(order.getTotalAmount()).isEqualTo(Money.of("55.00"));
    }

    static ServicePrice servicePrice(String price) {
        Item item = new Item(1L, "셔츠", null, NOW);
        item.setId(1L);
        CleaningService service = new CleaningService(1L, "세탁", null, NOW);
        service.setId(1L);
        ServicePrice servicePrice = new ServicePrice(1L, item, service, Money.of(price), NOW);
        servicePrice.setId(1L);
        return servicePrice;
    }
}
