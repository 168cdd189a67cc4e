package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Actor;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.*;
import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.repository.AccountRepository;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import com.drycleaning.domain.repository.LoyaltyTransactionRepository;
import com.drycleaning.domain.repository.OrderRepository;
import com.drycleaning.domain.service.LoyaltyDomainService;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import com.drycleaning.infrastructure.lock.DistributedLockExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 포인트 Application Facade 서비스
 *
 * 책임:
 * - 고객 단위 분산 락 관리 (사용/지급/소멸)
 * - 원장 조회 권한 검사
 * - DTO 변환
 *
 * 주의:
 * - 비즈니스 로직은 LoyaltyDomainService에 위임
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoyaltyService {

    private static final String LOCK_KEY_PREFIX = "lock:loyalty:";
    private static final int MAX_PAGE_SIZE = 100;

    private final AccessControl accessControl;
    private final AccountRepository accountRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final LoyaltyTransactionRepository loyaltyTransactionRepository;
    private final OrderRepository orderRepository;
    private final LoyaltyDomainService loyaltyDomainService;
    private final DistributedLockExecutor lockExecutor;
    private final Clock clock;

    public PointBalanceResponse getBalance(Long accountId, Long customerId) {
        requireLedgerAccess(accessControl.resolve(accountId), customerId);
        customerProfileRepository.getByAccountIdOrThrow(customerId);

        int balance = loyaltyDomainService.availableBalance(customerId, LocalDateTime.now(clock));
        return new PointBalanceResponse(customerId, balance);
    }

    public LoyaltyHistoryResponse getHistory(Long accountId, Long customerId, int page, int size) {
        requireLedgerAccess(accessControl.resolve(accountId), customerId);
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new BusinessException(ErrorKind.VALIDATION_FAILED,
                    "페이지 범위가 올바르지 않습니다: page=" + page + ", size=" + size);
        }
        return LoyaltyHistoryResponse.of(customerId,
                loyaltyTransactionRepository.findByCustomerId(customerId, PageRequest.of(page, size)));
    }

    public CustomerSummaryResponse getSummary(Long accountId, Long customerId) {
        requireLedgerAccess(accessControl.resolve(accountId), customerId);
        Account account = accountRepository.getByIdOrThrow(customerId);
        CustomerProfile profile = customerProfileRepository.getByAccountIdOrThrow(customerId);

        int balance = loyaltyDomainService.availableBalance(customerId, LocalDateTime.now(clock));
        return CustomerSummaryResponse.of(account, profile, balance);
    }

    /**
     * 포인트 사용
     * 고객 본인 또는 해당 고객이 주문한 매장에서 주문 접수 권한이 있는 직원만 사용할 수 있습니다.
     */
    public PointBalanceResponse redeem(Long accountId, Long customerId, PointRedeemRequest request) {
        Actor actor = accessControl.resolve(accountId);
        if (!actor.is(customerId)) {
            requireShopCustomer(actor, Capability.TAKE_ORDERS, customerId);
        }

        String description = request.description() != null ? request.description() : "포인트 사용";
        return lockExecutor.executeWithLock(LOCK_KEY_PREFIX + customerId, () -> {
            int balance = loyaltyDomainService.redeem(customerId, request.points(), description,
                    request.orderId(), actor.accountId(), LocalDateTime.now(clock));
            return new PointBalanceResponse(customerId, balance);
        });
    }

    /**
     * 보너스 지급 / 수동 조정 (점주, 관리자)
     */
    public PointBalanceResponse grant(Long accountId, Long customerId, PointGrantRequest request) {
        Actor actor = accessControl.resolve(accountId);
        requireShopCustomer(actor, Capability.GRANT_POINTS, customerId);
        Account customer = accountRepository.getByIdOrThrow(customerId);
        if (!customer.isCustomer()) {
            throw new BusinessException(ErrorKind.VALIDATION_FAILED, "고객 계정이 아닙니다: " + customerId);
        }

        String description = request.description() != null ? request.description() : request.type().name();
        return lockExecutor.executeWithLock(LOCK_KEY_PREFIX + customerId, () -> {
            int balance = loyaltyDomainService.grant(customerId, request.type(), request.points(), description,
                    actor.accountId(), LocalDateTime.now(clock));
            return new PointBalanceResponse(customerId, balance);
        });
    }

    /**
     * 만료된 포인트를 고객별로 소멸 처리합니다.
     *
     * @return 소멸 처리된 고객 수
     */
    public int expirePoints() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> customerIds = loyaltyTransactionRepository.findCustomerIdsWithExpiredCredits(now);

        int processed = 0;
        for (Long customerId : customerIds) {
            try {
                lockExecutor.executeWithLock(LOCK_KEY_PREFIX + customerId,
                        () -> loyaltyDomainService.expire(customerId, now));
                processed++;
            } catch (RuntimeException e) {
                log.error("포인트 소멸 처리 실패: customerId={}", customerId, e);
            }
        }
        return processed;
    }

    /**
     * 고객 본인, 관리자, 또는 고객이 주문한 매장의 직원/점주만 원장을 조회할 수 있습니다.
     */
    private void requireLedgerAccess(Actor actor, Long customerId) {
        if (actor.is(customerId)) {
            return;
        }
        requireShopCustomer(actor, Capability.VIEW_SHOP_ORDERS, customerId);
    }

    /**
     * 관리자를 제외하면 자기 매장에 주문 이력이 있는 고객만 다룰 수 있습니다.
     */
    private void requireShopCustomer(Actor actor, Capability capability, Long customerId) {
        if (actor.isAdmin()) {
            return;
        }
        actor.require(capability, actor.shopId());
        if (!orderRepository.existsByCustomerIdAndShopId(customerId, actor.shopId())) {
            throw new BusinessException(ErrorKind.FORBIDDEN,
                    "매장에 주문 이력이 없는 고객입니다: " + customerId);
        }
    }
}
