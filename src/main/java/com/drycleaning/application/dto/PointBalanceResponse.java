package com.drycleaning.application.dto;

public record PointBalanceResponse(
    Long customerId,
    int balance
) {}
