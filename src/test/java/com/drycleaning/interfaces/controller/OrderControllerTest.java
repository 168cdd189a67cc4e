package com.drycleaning.interfaces.controller;

import com.drycleaning.application.dto.*;
import com.drycleaning.application.service.OrderService;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(OrderController.class)
@DisplayName("OrderController 테스트")
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private OrderService orderService;

    private OrderCreateRequest createRequest() {
        return new OrderCreateRequest(
                10L,
                List.of(new OrderCreateRequest.OrderItemRequest(1L, 1L, 2, null)),
                null, null, "홍길동", "010-1234-5678", null, null,
                LocalDateTime.of(2025, 3, 11, 10, 0),
                LocalDateTime.of(2025, 3, 13, 18, 0));
    }

    @Test
    @DisplayName("주문을 생성하면 201과 주문 번호를 반환한다")
    void createOrder() throws Exception {
        // given
        when(orderService.createOrder(eq(3L), eq(1L), any(OrderCreateRequest.class)))
                .thenReturn(new OrderCreateResponse(100L, "ORD-2025-0001", new BigDecimal("25.00"), OrderStatus.RECEIVED));

        // when & then
        mockMvc.perform(post("/api/shops/1/orders")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(createRequest())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.orderNumber").value("ORD-2025-0001"))
                .andExpect(jsonPath("$.totalAmount").value(25.00))
                .andExpect(jsonPath("$.status").value("RECEIVED"));
    }

    @Test
    @DisplayName("허용되지 않은 상태 변경은 409와 INVALID_TRANSITION을 반환한다")
    void changeStatus_InvalidTransition() throws Exception {
        // given
        when(orderService.changeStatus(eq(3L), eq(100L), any(OrderStatusChangeRequest.class)))
                .thenThrow(new BusinessException(ErrorKind.INVALID_TRANSITION, "주문 상태를 변경할 수 없습니다: COMPLETED → IN_PROGRESS"));

        // when & then
        mockMvc.perform(patch("/api/orders/100/status")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"IN_PROGRESS\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_kind").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.message").value("주문 상태를 변경할 수 없습니다: COMPLETED → IN_PROGRESS"));
    }

    @Test
    @DisplayName("권한이 없으면 403과 FORBIDDEN을 반환한다")
    void changeStatus_Forbidden() throws Exception {
        when(orderService.changeStatus(eq(10L), eq(100L), any(OrderStatusChangeRequest.class)))
                .thenThrow(new BusinessException(ErrorKind.FORBIDDEN));

        mockMvc.perform(patch("/api/orders/100/status")
                        .header("X-Account-Id", 10L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"IN_PROGRESS\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error_kind").value("FORBIDDEN"));
    }

    @Test
    @DisplayName("상태 값이 없으면 400과 필드 오류를 반환한다")
    void changeStatus_MissingStatus() throws Exception {
        mockMvc.perform(patch("/api/orders/100/status")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field_errors[0].field").value("status"));
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("계정 헤더가 없으면 400을 반환한다")
    void missingAccountHeader() throws Exception {
        mockMvc.perform(get("/api/orders/100"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("VALIDATION_FAILED"));
    }

    @Test
    @DisplayName("빈 주문은 400과 EMPTY_ORDER를 반환한다")
    void createOrder_Empty() throws Exception {
        when(orderService.createOrder(eq(3L), eq(1L), any(OrderCreateRequest.class)))
                .thenThrow(new BusinessException(ErrorKind.EMPTY_ORDER));

        mockMvc.perform(post("/api/shops/1/orders")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\":10,\"items\":[],\"pickupAt\":\"2025-03-11T10:00:00\",\"deliveryAt\":\"2025-03-13T18:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("EMPTY_ORDER"));
    }

    @Test
    @DisplayName("수량이 999를 넘으면 400과 필드 오류를 반환한다")
    void createOrder_QuantityTooLarge() throws Exception {
        mockMvc.perform(post("/api/shops/1/orders")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\":10,\"items\":[{\"itemId\":1,\"serviceId\":1,\"quantity\":2147483647}],"
                                + "\"pickupAt\":\"2025-03-11T10:00:00\",\"deliveryAt\":\"2025-03-13T18:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.field_errors[0].field").value("items[0].quantity"));
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("주문 항목에 null이 있으면 400을 반환한다")
    void createOrder_NullItem() throws Exception {
        mockMvc.perform(post("/api/shops/1/orders")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customerId\":10,\"items\":[null],"
                                + "\"pickupAt\":\"2025-03-11T10:00:00\",\"deliveryAt\":\"2025-03-13T18:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_kind").value("VALIDATION_FAILED"));
        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("충돌이 아닌 무결성 오류는 500과 STORAGE_FAILURE를 반환한다")
    void createOrder_IntegrityViolation_StorageFailure() throws Exception {
        when(orderService.createOrder(eq(3L), eq(1L), any(OrderCreateRequest.class)))
                .thenThrow(new DataIntegrityViolationException("Data truncation: Out of range value for column 'total_price'"));

        mockMvc.perform(post("/api/shops/1/orders")
                        .header("X-Account-Id", 3L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(createRequest())))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_kind").value("STORAGE_FAILURE"));
    }

    @Test
    @DisplayName("매장 주문 목록을 상태로 필터링한다")
    void getShopOrders_FilterByStatus() throws Exception {
        when(orderService.getShopOrders(3L, 1L, OrderStatus.READY_FOR_PICKUP)).thenReturn(List.of());

        mockMvc.perform(get("/api/shops/1/orders")
                        .header("X-Account-Id", 3L)
                        .param("status", "READY_FOR_PICKUP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
        verify(orderService).getShopOrders(3L, 1L, OrderStatus.READY_FOR_PICKUP);
    }

    @Test
    @DisplayName("취소 주문을 삭제하면 204를 반환한다")
    void deleteOrder() throws Exception {
        mockMvc.perform(delete("/api/orders/100")
                        .header("X-Account-Id", 1L))
                .andExpect(status().isNoContent());
        verify(orderService).deleteOrder(1L, 100L);
    }
}
