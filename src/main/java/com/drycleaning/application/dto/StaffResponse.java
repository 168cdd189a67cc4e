package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.ShopStaff;

public record StaffResponse(
    Long staffId,
    Long shopId,
    Long accountId,
    String position,
    boolean active,
    boolean canTakeOrders,
    boolean canUpdateOrders,
    boolean canRegisterCustomers
) {

    public static StaffResponse from(ShopStaff staff) {
        return new StaffResponse(
                staff.getId(),
                staff.getShopId(),
                staff.getAccountId(),
                staff.getPosition(),
                staff.isActive(),
                staff.isCanTakeOrders(),
                staff.isCanUpdateOrders(),
                staff.isCanRegisterCustomers()
        );
    }
}
