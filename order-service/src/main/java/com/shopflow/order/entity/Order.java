package com.shopflow.order.entity;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문(Order) 엔티티 - 주문 도메인의 애그리거트 루트
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>상태 변경은 {@link #transitionTo}만 허용: {@link OrderStatus}에 정의된 전이가 아니면 INVALID_ORDER_STATUS</li>
 *   <li>@Version: 요청 스레드와 Saga 복구 스케줄러가 같은 주문을 동시에 바꾸는 경우를 감지</li>
 *   <li>requestKey: 클라이언트의 Idempotency-Key (nullable unique) - 같은 키의 재요청은 첫 주문을 돌려받는다</li>
 *   <li>amount는 클라이언트가 보낸 결제 금액 그대로 저장 (가격 계산은 하지 않는다)</li>
 * </ul>
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_order_request_key", columnNames = "requestKey"),
        indexes = {
                @Index(name = "idx_order_status", columnList = "status"),
                @Index(name = "idx_order_status_created", columnList = "status, createdAt")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_seq")
    @SequenceGenerator(name = "order_seq", sequenceName = "order_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<OrderItem> items = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(length = 512)
    private String failureReason;

    @Column(length = 128)
    private String requestKey;

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public Order(BigDecimal amount, String requestKey) {
        this.amount = amount;
        this.requestKey = requestKey;
        this.status = OrderStatus.NEW;
    }

    /** 주문 항목 추가 및 양방향 관계 설정 */
    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
    }

    /**
     * 상태 전이. 허용되지 않은 전이면 INVALID_ORDER_STATUS (409).
     *
     * @return 전이 전 상태
     */
    public OrderStatus transitionTo(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Order " + id + " cannot move from " + status + " to " + target);
        }
        OrderStatus previous = this.status;
        this.status = target;
        return previous;
    }

    /** 실패 확정 - 고객에게 보이는 사유를 함께 남긴다 */
    public OrderStatus fail(String reason) {
        OrderStatus previous = transitionTo(OrderStatus.FAILED);
        this.failureReason = reason;
        return previous;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order that)) return false;
        return id != null && id.equals(that.getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
