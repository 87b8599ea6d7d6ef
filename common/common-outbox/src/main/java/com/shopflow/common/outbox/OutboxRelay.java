package com.shopflow.common.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.data.domain.PageRequest;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Outbox 릴레이 - Polling Publisher
 *
 * <p>미발행 이벤트를 주기적으로 조회해 StreamBridge로 전송한다.
 * 실제 토픽은 application.yml의 바인딩 설정이 결정한다.</p>
 *
 * <h3>바인딩 네이밍 규칙</h3>
 * <pre>
 *   eventType              → Binding Name
 *   "OrderStatusChanged"   → "orderEvents-out-0"
 *   "ChargeRecorded"       → "billingEvents-out-0"
 *   "StockReserved"        → "inventoryEvents-out-0"
 *   "ReservationReleased"  → "inventoryEvents-out-0"
 * </pre>
 *
 * <p>전송 실패 시 그 자리에서 중단한다. 뒤의 이벤트를 먼저 보내면 같은 주문의 이벤트 순서가 뒤바뀌기 때문.
 * 다중 인스턴스에서는 ShedLock으로 한 인스턴스만 실행된다.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRelay {

    static final String UNKNOWN_BINDING = "unknownEvents-out-0";

    private final OutboxEventRepository outboxEventRepository;
    private final StreamBridge streamBridge;

    @Value("${outbox.relay.batch-size:100}")
    private int batchSize = 100;

    @Scheduled(fixedDelayString = "${outbox.relay.interval-ms:1000}")
    @SchedulerLock(name = "OutboxRelay_publishPendingEvents",
            lockAtMostFor = "30s", lockAtLeastFor = "1s")
    @Transactional
    public void publishPendingEvents() {
        List<OutboxEvent> pendingEvents = outboxEventRepository
                .findByPublishedFalseOrderByCreatedAtAscIdAsc(PageRequest.of(0, batchSize));

        int published = 0;
        for (OutboxEvent event : pendingEvents) {
            String binding = resolveBindingName(event.getEventType());
            try {
                Message<String> message = MessageBuilder
                        .withPayload(event.getPayload())
                        .setHeader("kafka_messageKey", event.getAggregateId())
                        .setHeader("eventType", event.getEventType())
                        .build();

                if (!streamBridge.send(binding, message)) {
                    log.error("StreamBridge send returned false: binding={}, eventId={}",
                            binding, event.getId());
                    break;
                }
            } catch (RuntimeException e) {
                log.error("Outbox relay failed: eventId={}, type={}", event.getId(), event.getEventType(), e);
                break;
            }
            event.markPublished();
            published++;
        }

        if (published > 0) {
            log.debug("Outbox relay published {} event(s)", published);
        }
    }

    static String resolveBindingName(String eventType) {
        return switch (eventType) {
            case "OrderStatusChanged" -> "orderEvents-out-0";
            case "ChargeRecorded" -> "billingEvents-out-0";
            case "StockReserved", "ReservationReleased" -> "inventoryEvents-out-0";
            default -> UNKNOWN_BINDING;
        };
    }
}
