package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.IntegrityViolations;
import com.flagship.gold_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Bridges {@link SettlementOrder} and {@link SettlementOrderEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceService {

    private final SettlementOrderRepository repository;

    @Transactional(readOnly = true)
    public boolean exists(String txRef) {
        return repository.existsById(txRef);
    }

    /**
     * Inserts a new order. The primary key rejects a reused tx reference that slipped past
     * the earlier check.
     */
    @Transactional
    public SettlementOrder insert(SettlementOrder order) {
        try {
            SettlementOrderEntity saved = repository.saveAndFlush(SettlementOrderEntity.fromDomain(order));
            log.debug("Saved order {}", saved.getTxRef());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (IntegrityViolations.isUniqueViolation(e)) {
                throw DuplicateException.txRef(order.getTxRef());
            }
            throw IntegrityViolations.rejected("Order " + order.getTxRef(), e);
        }
    }

    @Transactional
    public SettlementOrder update(SettlementOrder order) {
        SettlementOrderEntity existing = repository.findById(order.getTxRef())
            .orElseThrow(() -> NotFoundException.order(order.getTxRef()));
        existing.updateFromDomain(order);
        SettlementOrderEntity updated = repository.save(existing);
        log.debug("Updated order {} to {}", updated.getTxRef(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<SettlementOrder> findById(String txRef) {
        return repository.findById(txRef).map(SettlementOrderEntity::toDomain);
    }

    @Transactional
    public SettlementOrder lockById(String txRef) {
        return repository.findByIdForUpdate(txRef)
            .map(SettlementOrderEntity::toDomain)
            .orElseThrow(() -> NotFoundException.order(txRef));
    }

    @Transactional(readOnly = true)
    public List<SettlementOrder> findByStatus(OrderStatus status) {
        return repository.findByStatusOrderByCreatedAtAsc(status)
            .stream()
            .map(SettlementOrderEntity::toDomain)
            .toList();
    }
}
