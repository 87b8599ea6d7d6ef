package com.shopflow.inventory.repository;

import com.shopflow.inventory.entity.StockItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * 재고 저장소.
 *
 * <h3>findBySkuForUpdate - 비관적 락</h3>
 * <pre>
 * SELECT ... FROM stock_items WHERE sku = ? FOR UPDATE
 * → 같은 SKU를 건드리는 트랜잭션은 커밋될 때까지 대기
 * → 여러 SKU를 잠글 때는 항상 SKU 오름차순으로 잠가 교착 상태를 피한다
 * </pre>
 */
public interface StockItemRepository extends JpaRepository<StockItem, Long> {

    Optional<StockItem> findBySku(String sku);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StockItem s WHERE s.sku = :sku")
    Optional<StockItem> findBySkuForUpdate(@Param("sku") String sku);

    boolean existsBySku(String sku);
}
