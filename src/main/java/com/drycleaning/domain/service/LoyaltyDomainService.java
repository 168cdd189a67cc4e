package com.drycleaning.domain.service;

import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.LoyaltyTransaction;
import com.drycleaning.domain.entity.LoyaltyTransactionType;
import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import com.drycleaning.domain.repository.LoyaltyTransactionRepository;
import com.drycleaning.domain.repository.OrderRepository;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 포인트 도메인 서비스
 *
 * 책임:
 * - 주문 완료 적립과 고객 실적/등급 갱신
 * - 사용/조정 시 만료일이 빠른 적립분부터 차감 (FIFO)
 * - 만료 처리
 *
 * 잔액 = 만료되지 않은 적립 거래의 remainingPoints 합계.
 * 프로필의 loyaltyPoints는 이 값을 캐싱하며 모든 변경과 같은 트랜잭션에서 갱신됩니다.
 * 프로필 행 잠금으로 같은 고객에 대한 변경을 직렬화합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoyaltyDomainService {

    private final CustomerProfileRepository customerProfileRepository;
    private final LoyaltyTransactionRepository loyaltyTransactionRepository;
    private final OrderRepository orderRepository;
    private final LoyaltyPolicy loyaltyPolicy;

    /**
     * 고객 프로필이 없으면 생성합니다.
     */
    @Transactional
    public CustomerProfile ensureProfile(Long customerId, LocalDateTime now) {
        return customerProfileRepository.findByAccountId(customerId)
                .orElseGet(() -> {
                    log.info("고객 프로필 생성: customerId={}", customerId);
                    return customerProfileRepository.save(new CustomerProfile(customerId, now));
                });
    }

    /**
     * 완료된 주문에 대해 포인트를 적립하고 고객 실적을 갱신합니다.
     * 적립 포인트가 0이면 거래를 남기지 않습니다.
     *
     * @return 적립 포인트
     */
    @Transactional
    public int accrue(Order order, Long processedBy, LocalDateTime now) {
        CustomerProfile profile = lockProfile(order.getCustomerId(), now);
        profile.recordCompletedOrder(order.getTotalAmount(), now);

        int available = sumAvailable(
                loyaltyTransactionRepository.findAvailableCreditsForUpdate(order.getCustomerId(), now), now);
        int points = loyaltyPolicy.pointsFor(order.getTotalAmount());
        if (points > 0) {
            loyaltyTransactionRepository.save(LoyaltyTransaction.earned(
                    order.getCustomerId(), points, order.getId(),
                    "주문 완료 적립: " + order.getOrderNumber(),
                    loyaltyPolicy.expiresAt(now), processedBy, now));
        }
        profile.refreshBalance(available + points, now);
        customerProfileRepository.save(profile);

        log.info("포인트 적립: customerId={}, orderId={}, points={}, tier={}",
                order.getCustomerId(), order.getId(), points, profile.getMembershipTier());
        return points;
    }

    /**
     * 포인트를 사용합니다.
     *
     * @return 사용 후 잔액
     * @throws BusinessException INSUFFICIENT_POINTS - 잔액 부족, NOT_FOUND - 고객 주문이 아닌 경우
     */
    @Transactional
    public int redeem(Long customerId, int points, String description, Long orderId, Long processedBy,
                      LocalDateTime now) {
        requirePositive(points);
        if (orderId != null) {
            orderRepository.findById(orderId)
                    .filter(order -> order.isOwnedBy(customerId))
                    .orElseThrow(() -> BusinessException.notFound("주문", orderId));
        }

        CustomerProfile profile = customerProfileRepository.findByAccountIdForUpdate(customerId)
                .orElseThrow(() -> BusinessException.notFound("고객 프로필", customerId));
        int remaining = consumeCredits(customerId, points, now);

        loyaltyTransactionRepository.save(LoyaltyTransaction.redeemed(
                customerId, points, orderId, description, processedBy, now));
        profile.refreshBalance(remaining, now);
        customerProfileRepository.save(profile);

        log.info("포인트 사용: customerId={}, points={}, balance={}", customerId, points, remaining);
        return remaining;
    }

    /**
     * 보너스 지급 또는 수동 조정을 기록합니다.
     * BONUS는 양수만 허용되며 적립과 같은 유효기간을 가집니다.
     * ADJUSTMENT가 음수이면 사용과 같은 순서로 차감합니다.
     *
     * @return 처리 후 잔액
     */
    @Transactional
    public int grant(Long customerId, LoyaltyTransactionType type, int points, String description,
                     Long processedBy, LocalDateTime now) {
        CustomerProfile profile = lockProfile(customerId, now);
        int balance;

        if (type == LoyaltyTransactionType.BONUS) {
            requirePositive(points);
            balance = sumAvailable(loyaltyTransactionRepository.findAvailableCreditsForUpdate(customerId, now), now)
                    + points;
            loyaltyTransactionRepository.save(LoyaltyTransaction.bonus(
                    customerId, points, description, loyaltyPolicy.expiresAt(now), processedBy, now));
        } else if (type == LoyaltyTransactionType.ADJUSTMENT) {
            if (points == 0) {
                throw new BusinessException(ErrorKind.VALIDATION_FAILED, "조정 포인트는 0이 될 수 없습니다");
            }
            if (points > 0) {
                balance = sumAvailable(loyaltyTransactionRepository.findAvailableCreditsForUpdate(customerId, now), now)
                        + points;
            } else {
                balance = consumeCredits(customerId, -points, now);
            }
            loyaltyTransactionRepository.save(LoyaltyTransaction.adjustment(
                    customerId, points, description, processedBy, now));
        } else {
            throw new BusinessException(ErrorKind.VALIDATION_FAILED, "지급할 수 없는 거래 타입입니다: " + type);
        }

        profile.refreshBalance(balance, now);
        customerProfileRepository.save(profile);

        log.info("포인트 지급: customerId={}, type={}, points={}, balance={}", customerId, type, points, balance);
        return balance;
    }

    /**
     * 만료된 적립분의 잔량을 소멸 처리합니다.
     *
     * @return 소멸된 포인트
     */
    @Transactional
    public int expire(Long customerId, LocalDateTime now) {
        Optional<CustomerProfile> profile = customerProfileRepository.findByAccountIdForUpdate(customerId);
        List<LoyaltyTransaction> expiredCredits =
                loyaltyTransactionRepository.findExpiredCreditsForUpdate(customerId, now);

        int expired = 0;
        for (LoyaltyTransaction credit : expiredCredits) {
            expired += credit.consume(credit.getRemainingPoints());
        }
        if (expired == 0) {
            return 0;
        }

        loyaltyTransactionRepository.save(LoyaltyTransaction.expired(customerId, expired, now));
        int balance = sumAvailable(loyaltyTransactionRepository.findAvailableCreditsForUpdate(customerId, now), now);
        profile.ifPresent(p -> {
            p.refreshBalance(balance, now);
            customerProfileRepository.save(p);
        });

        log.info("포인트 소멸: customerId={}, points={}, balance={}", customerId, expired, balance);
        return expired;
    }

    /**
     * 현재 사용 가능한 포인트 잔액을 원장에서 계산합니다.
     */
    @Transactional(readOnly = true)
    public int availableBalance(Long customerId, LocalDateTime now) {
        return sumAvailable(loyaltyTransactionRepository.findByCustomerId(customerId), now);
    }

    private CustomerProfile lockProfile(Long customerId, LocalDateTime now) {
        return customerProfileRepository.findByAccountIdForUpdate(customerId)
                .orElseGet(() -> customerProfileRepository.save(new CustomerProfile(customerId, now)));
    }

    /**
     * 사용 가능한 적립분에서 만료일이 빠른 순서로 차감합니다.
     *
     * @return 차감 후 잔액
     */
    private int consumeCredits(Long customerId, int points, LocalDateTime now) {
        List<LoyaltyTransaction> credits = loyaltyTransactionRepository.findAvailableCreditsForUpdate(customerId, now);
        int available = sumAvailable(credits, now);
        if (points > available) {
            throw new BusinessException(ErrorKind.INSUFFICIENT_POINTS,
                    "포인트가 부족합니다. 요청: " + points + ", 잔액: " + available);
        }

        int left = points;
        for (LoyaltyTransaction credit : credits) {
            if (left == 0) {
                break;
            }
            left -= credit.consume(left);
        }
        return available - points;
    }

    private int sumAvailable(List<LoyaltyTransaction> transactions, LocalDateTime now) {
        return transactions.stream()
                .mapToInt(transaction -> transaction.availablePoints(now))
                .sum();
    }

    private void requirePositive(int points) {
        if (points <= 0) {
            throw new BusinessException(ErrorKind.VALIDATION_FAILED, "포인트는 0보다 커야 합니다: " + points);
        }
    }
}
