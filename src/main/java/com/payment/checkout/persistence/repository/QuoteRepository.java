package com.payment.checkout.persistence.repository;

import com.payment.checkout.persistence.entity.QuoteEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Spring Data repository for quotes. */
@Repository
public interface QuoteRepository extends JpaRepository<QuoteEntity, Long> {
}
