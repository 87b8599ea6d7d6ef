package com.shopflow.order.controller;

import com.shopflow.common.contract.LineItem;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.common.exception.GlobalExceptionHandler;
import com.shopflow.order.dto.OrderResponse;
import com.shopflow.order.service.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

    @Mock
    private OrderService orderService;

    @InjectMocks
    private OrderController orderController;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(orderController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("주문 접수 - Saga가 실패해도 201, 사유는 failureReason")
    void placeOrder_Failed_Still201() throws Exception {
        // Given
        given(orderService.placeOrder(anyList(), any(BigDecimal.class), eq("key-1")))
                .willReturn(new OrderResponse(1L, "FAILED", new BigDecimal("10.00"),
                        List.of(new LineItem("X", 1)), "Inventory rejected: Insufficient stock", null, null));

        // When & Then
        mockMvc.perform(post("/orders")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"sku\":\"X\",\"quantity\":1}],\"amount\":10.00}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("FAILED"))
                .andExpect(jsonPath("$.data.failureReason").value("Inventory rejected: Insufficient stock"));
    }

    @Test
    @DisplayName("빈 항목 목록은 400 invalid-request, Saga에 도달하지 않음")
    void placeOrder_EmptyItems_400() throws Exception {
        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[],\"amount\":10.00}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid-request"));

        verifyNoInteractions(orderService);
    }

    @Test
    @DisplayName("끝자리 0만 붙은 금액(10.000)은 웹 검증을 통과해 서비스로 전달")
    void placeOrder_TrailingZeroScale_Accepted() throws Exception {
        // Given
        given(orderService.placeOrder(anyList(), any(BigDecimal.class), any()))
                .willReturn(new OrderResponse(2L, "PAID", new BigDecimal("10.00"),
                        List.of(new LineItem("X", 1)), null, null, null));

        // When & Then
        mockMvc.perform(post("/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"sku\":\"X\",\"quantity\":1}],\"amount\":10.000}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.status").value("PAID"));
    }

    @Test
    @DisplayName("없는 주문 조회는 404 not-found")
    void getOrder_NotFound() throws Exception {
        given(orderService.getOrder(99L))
                .willThrow(new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: 99"));

        mockMvc.perform(get("/orders/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not-found"))
                .andExpect(jsonPath("$.detail").value("Order not found: 99"));
    }
}
