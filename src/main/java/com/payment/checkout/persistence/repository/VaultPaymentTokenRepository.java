package com.payment.checkout.persistence.repository;

import com.payment.checkout.persistence.entity.VaultPaymentTokenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for stored payment tokens.
 */
@Repository
public interface VaultPaymentTokenRepository extends JpaRepository<VaultPaymentTokenEntity, Long> {

    Optional<VaultPaymentTokenEntity> findByCustomerIdAndGatewayToken(String customerId, String gatewayToken);

    List<VaultPaymentTokenEntity> findByCustomerIdAndActiveTrue(String customerId);
}
