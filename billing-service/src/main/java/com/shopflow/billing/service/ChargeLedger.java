package com.shopflow.billing.service;

import com.shopflow.billing.entity.ChargeRecord;
import com.shopflow.billing.entity.ChargeStatus;
import com.shopflow.billing.repository.ChargeRecordRepository;
import com.shopflow.common.event.ChargeRecordedEvent;
import com.shopflow.common.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 결제 원장 쓰기 - 기록 1건 + ChargeRecorded Outbox 이벤트를 한 트랜잭션으로 저장한다.
 *
 * <p>saveAndFlush로 INSERT를 즉시 실행하므로, 같은 (orderId, idempotencyKey)의 동시 요청에서 진 쪽은
 * 이 메서드 안에서 DataIntegrityViolationException을 받고 트랜잭션이 롤백된다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChargeLedger {

    private final ChargeRecordRepository chargeRecordRepository;
    private final OutboxService outboxService;

    @Transactional
    public ChargeRecord append(Long orderId, BigDecimal amount, ChargeStatus status, String idempotencyKey) {
        ChargeRecord record = chargeRecordRepository.saveAndFlush(ChargeRecord.builder()
                .orderId(orderId)
                .amount(amount)
                .status(status)
                .referenceId(newReferenceId())
                .idempotencyKey(idempotencyKey)
                .build());

        outboxService.saveEvent("Charge", orderId.toString(), "ChargeRecorded",
                new ChargeRecordedEvent(orderId, amount, status.name(),
                        record.getReferenceId(), record.getCreatedAt()));

        log.info("Charge recorded: orderId={}, amount={}, status={}, referenceId={}",
                orderId, amount, status, record.getReferenceId());
        return record;
    }

    private static String newReferenceId() {
        return "ch_" + UUID.randomUUID().toString().replace("-", "");
    }
}
