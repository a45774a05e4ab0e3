package com.payment.checkout.persistence.repository;

import com.payment.checkout.domain.OrderStatus;
import com.payment.checkout.persistence.entity.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for sales orders.
 */
@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

    Optional<OrderEntity> findByIncrementId(String incrementId);

    List<OrderEntity> findByQuoteId(Long quoteId);

    List<OrderEntity> findByStatus(OrderStatus status);
}
