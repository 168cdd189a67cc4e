package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Actor;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.AccountResponse;
import com.drycleaning.application.dto.CustomerRegisterRequest;
import com.drycleaning.application.dto.StaffPermissionRequest;
import com.drycleaning.domain.entity.*;
import com.drycleaning.domain.repository.AccountRepository;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import com.drycleaning.domain.repository.ShopRepository;
import com.drycleaning.domain.repository.ShopStaffRepository;
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
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShopService 테스트")
class ShopServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneId.of("Asia/Seoul"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final Long SHOP_ID = 1L;

    @Mock
    private AccessControl accessControl;

    @Mock
    private ShopRepository shopRepository;

    @Mock
    private ShopStaffRepository shopStaffRepository;

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private CustomerProfileRepository customerProfileRepository;

    private ShopService shopService;

    @BeforeEach
    void setUp() {
        shopService = new ShopService(accessControl, shopRepository, shopStaffRepository, accountRepository,
                customerProfileRepository, CLOCK);
    }

    @Test
    @DisplayName("고객 등록 시 계정과 고객 프로필을 함께 만든다")
    void registerCustomer() {
        // given
        when(accessControl.resolve(3L)).thenReturn(new Actor(3L, AccountRole.STAFF, SHOP_ID,
                EnumSet.of(Capability.VIEW_SHOP_ORDERS, Capability.REGISTER_CUSTOMERS)));
        when(accountRepository.findByPhone("010-1234-5678")).thenReturn(Optional.empty());
        when(accountRepository.save(any(Account.class))).thenAnswer(invocation -> {
            Account account = invocation.getArgument(0);
            account.setId(10L);
            return account;
        });

        // when
        AccountResponse response = shopService.registerCustomer(3L, SHOP_ID,
                new CustomerRegisterRequest("홍길동", "010-1234-5678", null));

        // then
        assertThat(response.accountId()).isEqualTo(10L);
        assertThat(response.role()).isEqualTo(AccountRole.CUSTOMER);
        ArgumentCaptor<CustomerProfile> profile = ArgumentCaptor.forClass(CustomerProfile.class);
        verify(customerProfileRepository).save(profile.capture());
        assertThat(profile.getValue().getAccountId()).isEqualTo(10L);
    }

    @Test
    @DisplayName("이미 등록된 연락처는 DUPLICATE")
    void registerCustomer_DuplicatePhone() {
        Account existing = new Account("기존", "010-1234-5678", null, AccountRole.CUSTOMER, NOW);
        when(accessControl.resolve(1L)).thenReturn(new Actor(1L, AccountRole.SHOP_OWNER, SHOP_ID,
                EnumSet.allOf(Capability.class)));
        when(accountRepository.findByPhone("010-1234-5678")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> shopService.registerCustomer(1L, SHOP_ID,
                new CustomerRegisterRequest("홍길동", "010-1234-5678", null)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.DUPLICATE);
    }

    @Test
    @DisplayName("점주는 직원 권한을 바꾸고 비활성화할 수 있다")
    void updateStaff_Deactivate() {
        ShopStaff staff = new ShopStaff(SHOP_ID, 3L, "카운터", true, true, false, NOW);
        staff.setId(7L);
        when(accessControl.resolve(1L)).thenReturn(new Actor(1L, AccountRole.SHOP_OWNER, SHOP_ID,
                EnumSet.allOf(Capability.class)));
        when(shopStaffRepository.findById(7L)).thenReturn(Optional.of(staff));
        when(shopStaffRepository.save(staff)).thenReturn(staff);

        shopService.updateStaff(1L, SHOP_ID, 7L, new StaffPermissionRequest(true, false, true, false));

        assertThat(staff.isCanUpdateOrders()).isFalse();
        assertThat(staff.isCanRegisterCustomers()).isTrue();
        assertThat(staff.isActive()).isFalse();
    }

    @Test
    @DisplayName("직원은 다른 직원을 관리할 수 없다")
    void updateStaff_ByStaff_Forbidden() {
        when(accessControl.resolve(3L)).thenReturn(new Actor(3L, AccountRole.STAFF, SHOP_ID,
                EnumSet.of(Capability.VIEW_SHOP_ORDERS, Capability.TAKE_ORDERS)));

        assertThatThrownBy(() -> shopService.updateStaff(3L, SHOP_ID, 7L,
                new StaffPermissionRequest(true, true, true, true)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.FORBIDDEN);
    }
}
