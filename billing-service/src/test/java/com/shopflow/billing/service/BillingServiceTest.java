package com.shopflow.billing.service;

import com.shopflow.billing.entity.ChargeRecord;
import com.shopflow.billing.entity.ChargeStatus;
import com.shopflow.billing.repository.ChargeRecordRepository;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BillingServiceTest {

    @Mock
    private ChargeRecordRepository chargeRecordRepository;

    @Mock
    private ChargeDecisionPolicy chargeDecisionPolicy;

    @Mock
    private ChargeLedger chargeLedger;

    @InjectMocks
    private BillingService billingService;

    private static ChargeRecord record(Long orderId, String amount, ChargeStatus status, String key) {
        return ChargeRecord.builder()
                .orderId(orderId)
                .amount(new BigDecimal(amount))
                .status(status)
                .referenceId("ch_test")
                .idempotencyKey(key)
                .build();
    }

    @Test
    @DisplayName("신규 키 - 정책 판정 후 원장에 기록")
    void charge_NewKey_Appends() {
        // Given
        BigDecimal amount = new BigDecimal("25.00");
        given(chargeRecordRepository.findByOrderIdAndIdempotencyKey(1L, "charge-saga-1")).willReturn(Optional.empty());
        given(chargeDecisionPolicy.decide(1L, amount)).willReturn(ChargeStatus.APPROVED);
        ChargeRecord appended = record(1L, "25.00", ChargeStatus.APPROVED, "charge-saga-1");
        given(chargeLedger.append(1L, amount, ChargeStatus.APPROVED, "charge-saga-1")).willReturn(appended);

        // When
        ChargeRecord result = billingService.charge(1L, amount, "charge-saga-1");

        // Then
        assertThat(result).isSameAs(appended);
        assertThat(result.isApproved()).isTrue();
    }

    @Test
    @DisplayName("같은 키의 재요청은 기존 기록을 그대로 반환하고 재판정하지 않음")
    void charge_SameKey_ReturnsRecorded() {
        // Given
        ChargeRecord existing = record(2L, "25.00", ChargeStatus.DECLINED, "k-2");
        given(chargeRecordRepository.findByOrderIdAndIdempotencyKey(2L, "k-2")).willReturn(Optional.of(existing));

        // When
        ChargeRecord result = billingService.charge(2L, new BigDecimal("25.00"), "k-2");

        // Then
        assertThat(result).isSameAs(existing);
        verifyNoInteractions(chargeDecisionPolicy, chargeLedger);
    }

    @Test
    @DisplayName("동시 중복 요청에서 유니크 제약 위반 시 승자의 기록을 다시 읽어 반환")
    void charge_ConcurrentDuplicate_ReReadsWinner() {
        // Given
        BigDecimal amount = new BigDecimal("10.00");
        ChargeRecord winner = record(3L, "10.00", ChargeStatus.APPROVED, "k-3");
        given(chargeRecordRepository.findByOrderIdAndIdempotencyKey(3L, "k-3"))
                .willReturn(Optional.empty())
                .willReturn(Optional.of(winner));
        given(chargeDecisionPolicy.decide(3L, amount)).willReturn(ChargeStatus.APPROVED);
        given(chargeLedger.append(3L, amount, ChargeStatus.APPROVED, "k-3"))
                .willThrow(new DataIntegrityViolationException("uk_charge_order_idempotency_key"));

        // When
        ChargeRecord result = billingService.charge(3L, amount, "k-3");

        // Then
        assertThat(result).isSameAs(winner);
    }

    @Test
    @DisplayName("키 없이 들어온 요청은 새 키를 발급받아 매번 새 결제로 기록")
    void charge_WithoutKey_GeneratesKey() {
        // Given
        BigDecimal amount = new BigDecimal("5");
        given(chargeRecordRepository.findByOrderIdAndIdempotencyKey(eq(4L), anyString())).willReturn(Optional.empty());
        given(chargeDecisionPolicy.decide(4L, amount)).willReturn(ChargeStatus.APPROVED);
        given(chargeLedger.append(eq(4L), eq(amount), eq(ChargeStatus.APPROVED), anyString()))
                .willAnswer(invocation -> record(4L, "5", ChargeStatus.APPROVED, invocation.getArgument(3)));

        // When
        billingService.charge(4L, amount, null);

        // Then
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        verify(chargeLedger).append(eq(4L), eq(amount), eq(ChargeStatus.APPROVED), key.capture());
        assertThat(key.getValue()).startsWith("gen-");
    }

    @Test
    @DisplayName("0 이하 또는 소수점 3자리 금액은 INVALID_CHARGE_AMOUNT, 기록 없음")
    void charge_InvalidAmount() {
        assertThatThrownBy(() -> billingService.charge(5L, BigDecimal.ZERO, "k"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_CHARGE_AMOUNT));
        assertThatThrownBy(() -> billingService.charge(5L, new BigDecimal("1.005"), "k"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_CHARGE_AMOUNT));
        assertThatThrownBy(() -> billingService.charge(5L, null, "k"))
                .isInstanceOf(BusinessException.class);

        verifyNoInteractions(chargeRecordRepository, chargeDecisionPolicy);
        verify(chargeLedger, never()).append(any(), any(), any(), any());
    }
}
