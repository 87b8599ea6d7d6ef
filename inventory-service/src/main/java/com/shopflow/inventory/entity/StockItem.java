package com.shopflow.inventory.entity;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 재고(StockItem) 엔티티 - SKU 하나의 가용 수량
 *
 * <h3>동시성 제어</h3>
 * <ul>
 *   <li>예약/해제/입고는 행 단위 비관적 락(PESSIMISTIC_WRITE)으로 SKU별 직렬화</li>
 *   <li>@Version은 락 없이 들어오는 갱신을 감지하는 두 번째 방어선</li>
 * </ul>
 */
@Entity
@Table(name = "stock_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_stock_item_sku", columnNames = "sku")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class StockItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "stock_item_seq")
    @SequenceGenerator(name = "stock_item_seq", sequenceName = "stock_item_seq", allocationSize = 50)
    private Long id;

    @Version
    private Long version;

    @Column(nullable = false, length = 64)
    private String sku;

    @Column(nullable = false)
    private int available;     // 예약 가능한 수량 (항상 0 이상)

    @CreatedDate
    private LocalDateTime createdAt;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    @Builder
    public StockItem(String sku, int available) {
        if (available < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "available must be >= 0: sku=" + sku);
        }
        this.sku = sku;
        this.available = available;
    }

    public boolean canReserve(int quantity) {
        return quantity <= available;
    }

    /** 예약 수량만큼 차감. 호출 전 canReserve로 전체 SKU를 먼저 검사해야 한다. */
    public void decrease(int quantity) {
        if (!canReserve(quantity)) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK,
                    "Insufficient stock: sku=" + sku + ", requested=" + quantity + ", available=" + available);
        }
        this.available -= quantity;
    }

    /** 예약 해제 또는 입고로 수량 복원 */
    public void increase(int quantity) {
        this.available += quantity;
    }
}
