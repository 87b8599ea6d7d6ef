package com.shopflow.billing.service;

import com.shopflow.billing.entity.ChargeRecord;
import com.shopflow.billing.entity.ChargeStatus;
import com.shopflow.billing.repository.ChargeRecordRepository;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 결제 서비스 - 멱등 결제 처리
 *
 * <h3>charge 처리 순서</h3>
 * <pre>
 * 1. 금액 검증 (null, 0 이하, 소수점 3자리 이상 → INVALID_CHARGE_AMOUNT, 기록 없음)
 * 2. 멱등성 키가 없으면 새 키 발급 (매번 새 결제)
 * 3. (orderId, key)로 기존 기록 조회 → 있으면 그대로 반환 (재판정 없음)
 * 4. ChargeDecisionPolicy 판정 → ChargeLedger.append (기록 + Outbox, 한 트랜잭션)
 * 5. 유니크 제약 위반 (동시 중복 요청에서 패배) → 승자의 기록을 다시 읽어 반환
 * </pre>
 *
 * <p>이 메서드 자체는 트랜잭션을 열지 않는다. 5단계의 재조회는 실패한 트랜잭션 밖에서 실행되어야 한다.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BillingService {

    private static final int MAX_AMOUNT_SCALE = 2;

    private final ChargeRecordRepository chargeRecordRepository;
    private final ChargeDecisionPolicy chargeDecisionPolicy;
    private final ChargeLedger chargeLedger;

    public ChargeRecord charge(Long orderId, BigDecimal amount, String idempotencyKey) {
        validate(orderId, amount);
        String key = (idempotencyKey == null || idempotencyKey.isBlank())
                ? "gen-" + UUID.randomUUID()
                : idempotencyKey;

        Optional<ChargeRecord> existing = chargeRecordRepository.findByOrderIdAndIdempotencyKey(orderId, key);
        if (existing.isPresent()) {
            log.info("Duplicate charge request, returning recorded result: orderId={}, key={}, status={}",
                    orderId, key, existing.get().getStatus());
            return existing.get();
        }

        ChargeStatus decision = chargeDecisionPolicy.decide(orderId, amount);
        try {
            return chargeLedger.append(orderId, amount, decision, key);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent duplicate charge, re-reading winner: orderId={}, key={}", orderId, key);
            return chargeRecordRepository.findByOrderIdAndIdempotencyKey(orderId, key)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public List<ChargeRecord> listCharges(Long orderId) {
        if (orderId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "orderId is required");
        }
        return chargeRecordRepository.findByOrderIdOrderByIdAsc(orderId);
    }

    private void validate(Long orderId, BigDecimal amount) {
        if (orderId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "orderId is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_CHARGE_AMOUNT, "amount must be greater than 0");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new BusinessException(ErrorCode.INVALID_CHARGE_AMOUNT,
                    "amount must have at most " + MAX_AMOUNT_SCALE + " fraction digits");
        }
    }
}
