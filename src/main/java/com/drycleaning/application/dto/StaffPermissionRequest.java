package com.drycleaning.application.dto;

public record StaffPermissionRequest(
    boolean canTakeOrders,
    boolean canUpdateOrders,
    boolean canRegisterCustomers,
    boolean active
) {}
