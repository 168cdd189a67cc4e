package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 고객 주소 Entity
 *
 * 방문 수거/배송에 사용할 주소록입니다. 삭제는 비활성화(soft delete)로 처리하며,
 * 기본 주소는 고객별로 하나만 유지합니다. (CustomerAddressDomainService에서 보장)
 */
@Entity
@Table(name = "customer_addresses",
        indexes = @Index(name = "idx_customer_addresses_customer_id", columnList = "customer_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerAddress extends BaseTimeEntity {

    public static final String DEFAULT_COUNTRY = "USA";

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private AddressType type;

    @Column(name = "label", nullable = false, length = 50)
    private String label;

    @Column(name = "street_address", nullable = false, length = 255)
    private String streetAddress;

    @Column(name = "apartment_unit", length = 50)
    private String apartmentUnit;

    @Column(name = "city", nullable = false, length = 100)
    private String city;

    @Column(name = "state", nullable = false, length = 50)
    private String state;

    @Column(name = "postal_code", nullable = false, length = 20)
    private String postalCode;

    @Column(name = "country", nullable = false, length = 100)
    private String country;

    @Column(name = "is_default", nullable = false)
    private boolean defaultAddress;

    @Column(name = "pickup_instructions", columnDefinition = "TEXT")
    private String pickupInstructions;

    @Column(name = "active", nullable = false)
    private boolean active;

    public CustomerAddress(Long customerId, AddressDetails details, boolean defaultAddress, LocalDateTime now) {
        if (customerId == null) {
            throw new IllegalArgumentException("고객 ID는 필수입니다");
        }
        this.customerId = customerId;
        apply(details);
        this.defaultAddress = defaultAddress;
        this.active = true;
        initializeTimestamps(now);
    }

    public void update(AddressDetails details, LocalDateTime now) {
        apply(details);
        updateTimestamp(now);
    }

    public void markDefault(LocalDateTime now) {
        this.defaultAddress = true;
        updateTimestamp(now);
    }

    public void clearDefault(LocalDateTime now) {
        this.defaultAddress = false;
        updateTimestamp(now);
    }

    /**
     * 비활성화된 주소는 기본 주소가 될 수 없습니다.
     */
    public void deactivate(LocalDateTime now) {
        this.active = false;
        this.defaultAddress = false;
        updateTimestamp(now);
    }

    public boolean isOwnedBy(Long accountId) {
        return customerId.equals(accountId);
    }

    public boolean hasLabel(String other) {
        return label.equalsIgnoreCase(other.trim());
    }

    /**
     * 한 줄 주소 (예: "123 Main St, Apt 4B, Springfield, IL 62701, USA")
     */
    public String getFullAddress() {
        StringBuilder sb = new StringBuilder(streetAddress);
        if (apartmentUnit != null && !apartmentUnit.isBlank()) {
            sb.append(", ").append(apartmentUnit);
        }
        sb.append(", ").append(city)
                .append(", ").append(state).append(' ').append(postalCode)
                .append(", ").append(country);
        return sb.toString();
    }

    private void apply(AddressDetails details) {
        if (details == null || isBlank(details.label())) {
            throw new IllegalArgumentException("주소 별칭은 필수입니다");
        }
        if (isBlank(details.streetAddress()) || isBlank(details.city())
                || isBlank(details.state()) || isBlank(details.postalCode())) {
            throw new IllegalArgumentException("도로명 주소, 도시, 주/도, 우편번호는 필수입니다");
        }
        this.type = details.type() != null ? details.type() : AddressType.HOME;
        this.label = details.label().trim();
        this.streetAddress = details.streetAddress();
        this.apartmentUnit = details.apartmentUnit();
        this.city = details.city();
        this.state = details.state();
        this.postalCode = details.postalCode();
        this.country = isBlank(details.country()) ? DEFAULT_COUNTRY : details.country();
        this.pickupInstructions = details.pickupInstructions();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
