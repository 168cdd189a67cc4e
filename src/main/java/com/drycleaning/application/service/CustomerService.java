package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.CustomerAnalyticsResponse;
import com.drycleaning.application.dto.CustomerAnalyticsResponse.UsageCount;
import com.drycleaning.application.dto.CustomerSummaryResponse;
import com.drycleaning.application.dto.ShopCustomerStatsResponse;
import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.MembershipTier;
import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderItem;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.repository.AccountRepository;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import com.drycleaning.domain.repository.OrderItemRepository;
import com.drycleaning.domain.repository.OrderRepository;
import com.drycleaning.domain.repository.ShopRepository;
import com.drycleaning.domain.vo.Money;
import com.drycleaning.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 매장 고객 조회 서비스 (점주 전용)
 *
 * 매장의 고객 = 해당 매장에 주문 이력이 있는 고객.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CustomerService {

    private static final int PREFERENCE_LIMIT = 5;
    private static final int RANKING_LIMIT = 10;
    private static final int NEW_CUSTOMER_DAYS = 30;
    private static final int ACTIVE_CUSTOMER_DAYS = 90;

    private final AccessControl accessControl;
    private final ShopRepository shopRepository;
    private final AccountRepository accountRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final Clock clock;

    /**
     * @param search 이름/연락처/이메일 부분 검색어
     * @param tier 회원 등급 필터
     */
    public List<CustomerSummaryResponse> getShopCustomers(Long accountId, Long shopId, String search,
                                                          MembershipTier tier) {
        requireCustomerView(accountId, shopId);
        return toSummaries(customerProfileRepository.findShopCustomers(shopId, search, tier));
    }

    public CustomerAnalyticsResponse getCustomerAnalytics(Long accountId, Long shopId, Long customerId) {
        requireCustomerView(accountId, shopId);
        if (!orderRepository.existsByCustomerIdAndShopId(customerId, shopId)) {
            throw BusinessException.notFound("고객", customerId);
        }
        Account account = accountRepository.getByIdOrThrow(customerId);
        CustomerProfile profile = customerProfileRepository.getByAccountIdOrThrow(customerId);

        List<Order> completed = orderRepository.findByShopIdAndCustomerIdAndStatus(
                shopId, customerId, OrderStatus.COMPLETED);
        Money totalSpent = completed.stream()
                .map(Order::getTotalAmount)
                .reduce(Money.zero(), Money::add);
        LocalDateTime firstOrderAt = completed.stream()
                .map(Order::getCreatedAt)
                .min(Comparator.naturalOrder())
                .orElse(null);
        LocalDateTime lastOrderAt = completed.stream()
                .map(Order::getCreatedAt)
                .max(Comparator.naturalOrder())
                .orElse(null);
        Long daysSinceLastOrder = lastOrderAt != null
                ? ChronoUnit.DAYS.between(lastOrderAt, LocalDateTime.now(clock))
                : null;

        List<OrderItem> items = orderItemRepository.findByOrderIdIn(
                completed.stream().map(Order::getId).toList());

        return new CustomerAnalyticsResponse(
                customerId,
                account.getName(),
                profile.getMembershipTier(),
                totalSpent.getAmount(),
                completed.size(),
                average(totalSpent.getAmount(), completed.size()),
                profile.getLoyaltyPoints(),
                firstOrderAt,
                lastOrderAt,
                daysSinceLastOrder,
                topByQuantity(items, OrderItem::getSnapshotServiceName),
                topByQuantity(items, OrderItem::getSnapshotItemName)
        );
    }

    public ShopCustomerStatsResponse getShopCustomerStats(Long accountId, Long shopId) {
        requireCustomerView(accountId, shopId);
        List<CustomerProfile> profiles = customerProfileRepository.findShopCustomers(shopId, null, null);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime newSince = now.minusDays(NEW_CUSTOMER_DAYS);
        LocalDateTime activeSince = now.minusDays(ACTIVE_CUSTOMER_DAYS);

        Map<MembershipTier, Long> tierDistribution = new EnumMap<>(MembershipTier.class);
        for (MembershipTier tier : MembershipTier.values()) {
            tierDistribution.put(tier, 0L);
        }
        profiles.forEach(p -> tierDistribution.merge(p.getMembershipTier(), 1L, Long::sum));

        long newCustomers = profiles.stream()
                .filter(p -> p.getCreatedAt() != null && !p.getCreatedAt().isBefore(newSince))
                .count();
        long activeCustomers = profiles.stream()
                .filter(p -> p.getLastOrderAt() != null && !p.getLastOrderAt().isBefore(activeSince))
                .count();
        long pointsOutstanding = profiles.stream()
                .mapToLong(CustomerProfile::getLoyaltyPoints)
                .sum();
        BigDecimal totalValue = profiles.stream()
                .map(p -> p.getTotalSpent().getAmount())
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        List<CustomerProfile> topSpenders = profiles.stream()
                .sorted(Comparator.comparing((CustomerProfile p) -> p.getTotalSpent().getAmount()).reversed())
                .limit(RANKING_LIMIT)
                .toList();
        List<CustomerProfile> mostLoyal = profiles.stream()
                .sorted(Comparator.comparing(CustomerProfile::getLoyaltyPoints).reversed())
                .limit(RANKING_LIMIT)
                .toList();

        return new ShopCustomerStatsResponse(
                profiles.size(),
                tierDistribution,
                newCustomers,
                activeCustomers,
                pointsOutstanding,
                average(totalValue, profiles.size()),
                toSummaries(topSpenders),
                toSummaries(mostLoyal)
        );
    }

    private void requireCustomerView(Long accountId, Long shopId) {
        accessControl.resolve(accountId).require(Capability.VIEW_CUSTOMERS, shopId);
        shopRepository.getByIdOrThrow(shopId);
    }

    private List<CustomerSummaryResponse> toSummaries(List<CustomerProfile> profiles) {
        if (profiles.isEmpty()) {
            return List.of();
        }
        Map<Long, Account> accounts = accountRepository.findAllById(
                        profiles.stream().map(CustomerProfile::getAccountId).toList()).stream()
                .collect(Collectors.toMap(Account::getId, Function.identity()));
        return profiles.stream()
                .filter(p -> accounts.containsKey(p.getAccountId()))
                .map(p -> CustomerSummaryResponse.of(accounts.get(p.getAccountId()), p, p.getLoyaltyPoints()))
                .toList();
    }

    private static BigDecimal average(BigDecimal total, int count) {
        if (count == 0) {
            return BigDecimal.ZERO.setScale(Money.SCALE);
        }
        return total.divide(BigDecimal.valueOf(count), Money.SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 이름별 수량 합계 상위 항목. 수량이 같으면 이름 순.
     */
    private static List<UsageCount> topByQuantity(List<OrderItem> items, Function<OrderItem, String> name) {
        Map<String, Integer> totals = new HashMap<>();
        for (OrderItem item : items) {
            totals.merge(name.apply(item), item.getQuantity(), Integer::sum);
        }
        return totals.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(PREFERENCE_LIMIT)
                .map(e -> new UsageCount(e.getKey(), e.getValue()))
                .toList();
    }
}
