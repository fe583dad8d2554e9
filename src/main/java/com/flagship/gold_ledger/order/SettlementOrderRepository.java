package com.flagship.gold_ledger.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SettlementOrderRepository extends JpaRepository<SettlementOrderEntity, String> {

    /**
     * Loads an order with a row lock; concurrent sign/execute calls on one order serialize here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM SettlementOrderEntity o WHERE o.txRef = :txRef")
    Optional<SettlementOrderEntity> findByIdForUpdate(@Param("txRef") String txRef);

    List<SettlementOrderEntity> findByStatusOrderByCreatedAtAsc(OrderStatus status);
}
