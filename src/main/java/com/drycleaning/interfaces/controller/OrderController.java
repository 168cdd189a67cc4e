package com.drycleaning.interfaces.controller;

import com.drycleaning.api.OrderApi;
import com.drycleaning.application.dto.*;
import com.drycleaning.application.service.OrderService;
import com.drycleaning.domain.entity.OrderStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class OrderController implements OrderApi {

    private final OrderService orderService;

    @Override
    public OrderCreateResponse createOrder(Long accountId, Long shopId, OrderCreateRequest request) {
        return orderService.createOrder(accountId, shopId, request);
    }

    @Override
    public OrderDetailResponse getOrder(Long accountId, Long orderId) {
        return orderService.getOrder(accountId, orderId);
    }

    @Override
    public List<OrderSummaryResponse> getMyOrders(Long accountId) {
        return orderService.getMyOrders(accountId);
    }

    @Override
    public List<OrderSummaryResponse> getShopOrders(Long accountId, Long shopId, OrderStatus status) {
        return orderService.getShopOrders(accountId, shopId, status);
    }

    @Override
    public OrderStatusResponse changeStatus(Long accountId, Long orderId, OrderStatusChangeRequest request) {
        return orderService.changeStatus(accountId, orderId, request);
    }

    @Override
    public OrderDetailResponse addItem(Long accountId, Long orderId, OrderItemAddRequest request) {
        return orderService.addItem(accountId, orderId, request);
    }

    @Override
    public OrderDetailResponse removeItem(Long accountId, Long orderId, Long orderItemId) {
        return orderService.removeItem(accountId, orderId, orderItemId);
    }

    @Override
    public void deleteOrder(Long accountId, Long orderId) {
        orderService.deleteOrder(accountId, orderId);
    }
}
