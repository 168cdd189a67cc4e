package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 매장별·연도별 주문 번호 시퀀스 Entity
 *
 * 행 잠금(SELECT ... FOR UPDATE)으로 조회한 뒤 같은 트랜잭션 안에서 증가시킵니다.
 * (shop_id, seq_year) 유니크 제약이 최초 생성 경합을 막습니다.
 */
@Entity
@Table(name = "order_number_sequences",
        uniqueConstraints = @UniqueConstraint(name = "uk_order_number_sequences_shop_year",
                columnNames = {"shop_id", "seq_year"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderNumberSequence extends BaseEntity {

    private static final String PREFIX = "ORD-";

    @Column(name = "shop_id", nullable = false)
    private Long shopId;

    @Column(name = "seq_year", nullable = false)
    private Integer year;

    @Column(name = "last_value", nullable = false)
    private Integer lastValue;

    public OrderNumberSequence(Long shopId, int year) {
        if (shopId == null) {
            throw new IllegalArgumentException("매장 ID는 필수입니다");
        }
        this.shopId = shopId;
        this.year = year;
        this.lastValue = 0;
    }

    /**
     * 다음 번호를 발급합니다.
     *
     * @return ORD-{연도}-{4자리 일련번호} 형식의 주문 번호
     */
    public String next() {
        this.lastValue++;
        return format(year, lastValue);
    }

    public static String format(int year, int sequence) {
        return PREFIX + year + "-" + String.format("%04d", sequence);
    }
}
