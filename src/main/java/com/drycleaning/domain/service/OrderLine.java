package com.drycleaning.domain.service;

/**
 * 주문 항목 입력
 */
public record OrderLine(Long itemId, Long serviceId, int quantity, String notes) {
}
