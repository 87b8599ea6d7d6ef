package com.shopflow.inventory.dto;

import jakarta.validation.constraints.Positive;

/** 입고 요청 - 더할 수량 */
public record RestockRequest(@Positive int quantity) {
}
