package com.shopflow.order.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 주문 항목 - SKU와 수량. 재고 서비스의 StockItem을 SKU 문자열로만 참조한다 (FK 없음).
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "order_item_seq")
    @SequenceGenerator(name = "order_item_seq", sequenceName = "order_item_seq", allocationSize = 50)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id")
    @Setter(AccessLevel.PACKAGE)  // Order.addItem()에서만 설정
    private Order order;

    @Column(nullable = false, length = 64)
    private String sku;

    @Column(nullable = false)
    private int quantity;

    @Builder
    public OrderItem(String sku, int quantity) {
        this.sku = sku;
        this.quantity = quantity;
    }
}
