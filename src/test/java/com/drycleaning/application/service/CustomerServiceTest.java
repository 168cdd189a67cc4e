package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Actor;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.CustomerAnalyticsResponse;
import com.drycleaning.application.dto.CustomerAnalyticsResponse.UsageCount;
import com.drycleaning.application.dto.CustomerSummaryResponse;
import com.drycleaning.application.dto.ShopCustomerStatsResponse;
import com.drycleaning.domain.entity.*;
import com.drycleaning.domain.repository.*;
import com.drycleaning.domain.vo.Money;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomerService 테스트")
class CustomerServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final Long SHOP_ID = 1L;
    private static final Long OWNER_ID = 1L;
    private static final Long CUSTOMER_ID = 10L;

    @Mock
    private AccessControl accessControl;

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

    private CustomerService customerService;

    @BeforeEach
    void setUp() {
        customerService = new CustomerService(accessControl, shopRepository, accountRepository,
                customerProfileRepository, orderRepository, orderItemRepository, CLOCK);
    }

    private void ownerRequests() {
        when(accessControl.resolve(OWNER_ID)).thenReturn(new Actor(OWNER_ID, AccountRole.SHOP_OWNER, SHOP_ID,
                EnumSet.allOf(Capability.class)));
    }

    private static Account customer(Long id, String name) {
        Account account = new Account(name, "010-0000-00" + id, null, AccountRole.CUSTOMER, NOW);
        account.setId(id);
        return account;
    }

    private static CustomerProfile profile(Long customerId, LocalDateTime joinedAt, String spent,
                                           LocalDateTime lastOrderAt, int points) {
        CustomerProfile profile = new CustomerProfile(customerId, joinedAt);
        profile.recordCompletedOrder(Money.of(spent), lastOrderAt);
        profile.refreshBalance(points, lastOrderAt);
        return profile;
    }

    private static Order completedOrder(Long orderId, LocalDateTime createdAt, List<OrderItem> items) {
        Order order = new Order(SHOP_ID, CUSTOMER_ID, "ORD-2025-000" + orderId, OWNER_ID,
                new OrderDetails(null, null, null, null, null, null, createdAt.plusDays(1), createdAt.plusDays(3)),
                createdAt);
        order.setId(orderId);
        order.recalculateTotal(items, createdAt);
        return order;
    }

    private static ServicePrice price(Long id, String itemName, String serviceName, String amount) {
        Item item = new Item(SHOP_ID, itemName, null, NOW);
        item.setId(id);
        CleaningService service = new CleaningService(SHOP_ID, serviceName, null, NOW);
        service.setId(id);
        return new ServicePrice(SHOP_ID, item, service, Money.of(amount), NOW);
    }

    @Test
    @DisplayName("검색어와 등급으로 매장 고객을 조회한다")
    void getShopCustomers() {
        // given
        ownerRequests();
        CustomerProfile gold = profile(CUSTOMER_ID, NOW.minusDays(60), "600", NOW.minusDays(1), 30);
        when(customerProfileRepository.findShopCustomers(SHOP_ID, "홍", MembershipTier.GOLD))
                .thenReturn(List.of(gold));
        when(accountRepository.findAllById(List.of(CUSTOMER_ID)))
                .thenReturn(List.of(customer(CUSTOMER_ID, "홍길동")));

        // when
        List<CustomerSummaryResponse> result = customerService.getShopCustomers(OWNER_ID, SHOP_ID, "홍",
                MembershipTier.GOLD);

        // then
        assertThat(result).hasSize(1);
        assertThat(result.get(0).name()).isEqualTo("홍길동");
        assertThat(result.get(0).membershipTier()).isEqualTo(MembershipTier.GOLD);
        assertThat(result.get(0).loyaltyPoints()).isEqualTo(30);
    }

    @Test
    @DisplayName("직원은 매장 고객 목록을 조회할 수 없다")
    void getShopCustomers_ByStaff_Forbidden() {
        when(accessControl.resolve(3L)).thenReturn(new Actor(3L, AccountRole.STAFF, SHOP_ID,
                EnumSet.of(Capability.VIEW_SHOP_ORDERS, Capability.TAKE_ORDERS, Capability.REGISTER_CUSTOMERS)));

        assertThatThrownBy(() -> customerService.getShopCustomers(3L, SHOP_ID, null, null))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
        verifyNoInteractions(customerProfileRepository);
    }

    @Test
    @DisplayName("다른 매장의 점주는 고객 통계를 조회할 수 없다")
    void getShopCustomerStats_OtherShopOwner_Forbidden() {
        when(accessControl.resolve(5L)).thenReturn(new Actor(5L, AccountRole.SHOP_OWNER, 2L,
                EnumSet.allOf(Capability.class)));

        assertThatThrownBy(() -> customerService.getShopCustomerStats(5L, SHOP_ID))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
    }

    @Test
    @DisplayName("고객 분석은 매장의 완료 주문으로 금액과 선호 서비스/품목을 집계한다")
    void getCustomerAnalytics() {
        // given
        ownerRequests();
        ServicePrice shirtWash = price(1L, "셔츠", "세탁", "12.50");
        ServicePrice pantsDry = price(2L, "바지", "드라이클리닝", "8.00");

        LocalDateTime firstAt = NOW.minusDays(10);
        LocalDateTime lastAt = NOW.minusDays(4);
        List<OrderItem> firstItems = List.of(new OrderItem(1L, shirtWash, "셔츠", "세탁", 2, null, firstAt));
        List<OrderItem> lastItems = List.of(
                new OrderItem(2L, shirtWash, "셔츠", "세탁", 1, null, lastAt),
                new OrderItem(2L, pantsDry, "바지", "드라이클리닝", 4, null, lastAt));
        Order first = completedOrder(1L, firstAt, firstItems);
        Order last = completedOrder(2L, lastAt, lastItems);

        when(orderRepository.existsByCustomerIdAndShopId(CUSTOMER_ID, SHOP_ID)).thenReturn(true);
        when(accountRepository.getByIdOrThrow(CUSTOMER_ID)).thenReturn(customer(CUSTOMER_ID, "홍길동"));
        when(customerProfileRepository.getByAccountIdOrThrow(CUSTOMER_ID))
                .thenReturn(profile(CUSTOMER_ID, firstAt, "69.50", lastAt, 6));
        when(orderRepository.findByShopIdAndCustomerIdAndStatus(SHOP_ID, CUSTOMER_ID, OrderStatus.COMPLETED))
                .thenReturn(List.of(last, first));
        when(orderItemRepository.findByOrderIdIn(List.of(2L, 1L)))
                .thenReturn(List.of(lastItems.get(0), lastItems.get(1), firstItems.get(0)));

        // when
        CustomerAnalyticsResponse result = customerService.getCustomerAnalytics(OWNER_ID, SHOP_ID, CUSTOMER_ID);

        // then
        assertThat(result.totalSpent()).isEqualByComparingTo("69.50");
        assertThat(result.completedOrders()).isEqualTo(2);
        assertThat(result.averageOrderValue()).isEqualByComparingTo("34.75");
        assertThat(result.firstOrderAt()).isEqualTo(firstAt);
        assertThat(result.lastOrderAt()).isEqualTo(lastAt);
        assertThat(result.daysSinceLastOrder()).isEqualTo(4L);
        assertThat(result.loyaltyPoints()).isEqualTo(6);
        assertThat(result.preferredServices())
                .containsExactly(new UsageCount("드라이클리닝", 4), new UsageCount("세탁", 3));
        assertThat(result.preferredItems())
                .containsExactly(new UsageCount("바지", 4), new UsageCount("셔츠", 3));
    }

    @Test
    @DisplayName("완료 주문이 없으면 금액은 0이고 최근 주문 경과일은 비어 있다")
    void getCustomerAnalytics_NoCompletedOrders() {
        // given
        ownerRequests();
        when(orderRepository.existsByCustomerIdAndShopId(CUSTOMER_ID, SHOP_ID)).thenReturn(true);
        when(accountRepository.getByIdOrThrow(CUSTOMER_ID)).thenReturn(customer(CUSTOMER_ID, "홍길동"));
        when(customerProfileRepository.getByAccountIdOrThrow(CUSTOMER_ID))
                .thenReturn(new CustomerProfile(CUSTOMER_ID, NOW));
        when(orderRepository.findByShopIdAndCustomerIdAndStatus(SHOP_ID, CUSTOMER_ID, OrderStatus.COMPLETED))
                .thenReturn(List.of());
        when(orderItemRepository.findByOrderIdIn(List.of())).thenReturn(List.of());

        // when
        CustomerAnalyticsResponse result = customerService.getCustomerAnalytics(OWNER_ID, SHOP_ID, CUSTOMER_ID);

        // then
        assertThat(result.completedOrders()).isZero();
        assertThat(result.averageOrderValue()).isEqualByComparingTo("0");
        assertThat(result.daysSinceLastOrder()).isNull();
        assertThat(result.preferredServices()).isEmpty();
    }

    @Test
    @DisplayName("매장에 주문 이력이 없는 고객의 분석은 NOT_FOUND")
    void getCustomerAnalytics_NotShopCustomer() {
        ownerRequests();
        when(orderRepository.existsByCustomerIdAndShopId(CUSTOMER_ID, SHOP_ID)).thenReturn(false);

        assertThatThrownBy(() -> customerService.getCustomerAnalytics(OWNER_ID, SHOP_ID, CUSTOMER_ID))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.NOT_FOUND);
        verifyNoInteractions(accountRepository, customerProfileRepository);
    }

    @Test
    @DisplayName("고객 통계는 등급 분포, 신규/활성 고객, 미사용 포인트, 상위 고객을 집계한다")
    void getShopCustomerStats() {
        // given
        ownerRequests();
        CustomerProfile gold = profile(10L, NOW.minusDays(100), "600", NOW.minusDays(100), 50);
        CustomerProfile bronze = profile(11L, NOW.minusDays(5), "100", NOW.minusDays(2), 200);
        CustomerProfile silver = profile(12L, NOW.minusDays(40), "250", NOW.minusDays(20), 10);
        when(customerProfileRepository.findShopCustomers(SHOP_ID, null, null))
                .thenReturn(List.of(bronze, silver, gold));
        when(accountRepository.findAllById(anyCollection())).thenReturn(List.of(
                customer(10L, "김골드"), customer(11L, "이브론즈"), customer(12L, "박실버")));

        // when
        ShopCustomerStatsResponse stats = customerService.getShopCustomerStats(OWNER_ID, SHOP_ID);

        // then
        assertThat(stats.totalCustomers()).isEqualTo(3);
        assertThat(stats.tierDistribution())
                .containsEntry(MembershipTier.BRONZE, 1L)
                .containsEntry(MembershipTier.SILVER, 1L)
                .containsEntry(MembershipTier.GOLD, 1L)
                .containsEntry(MembershipTier.PLATINUM, 0L);
        assertThat(stats.newCustomers()).isEqualTo(1);
        assertThat(stats.activeCustomers()).isEqualTo(2);
        assertThat(stats.totalLoyaltyPointsOutstanding()).isEqualTo(260);
        assertThat(stats.averageCustomerValue()).isEqualByComparingTo("316.67");
        assertThat(stats.topSpenders()).extracting(CustomerSummaryResponse::customerId)
                .containsExactly(10L, 12L, 11L);
        assertThat(stats.mostLoyal()).extracting(CustomerSummaryResponse::customerId)
                .containsExactly(11L, 10L, 12L);
    }
}
