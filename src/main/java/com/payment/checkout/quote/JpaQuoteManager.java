package com.payment.checkout.quote;

import com.payment.checkout.core.CollaboratorResult;
import com.payment.checkout.core.QuoteManager;
import com.payment.checkout.persistence.entity.QuoteEntity;
import com.payment.checkout.persistence.repository.QuoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Deactivates quotes once their order is paid, in a transaction of its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaQuoteManager implements QuoteManager {

    private final QuoteRepository quoteRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public CollaboratorResult disableQuote(Long quoteId) {
        if (quoteId == null) {
            return CollaboratorResult.failed(new IllegalArgumentException("quoteId is required"));
        }
        try {
            Optional<QuoteEntity> quote = quoteRepository.findById(quoteId);
            if (quote.isEmpty()) {
                return CollaboratorResult.failed(new IllegalStateException("Quote " + quoteId + " not found"));
            }
            QuoteEntity entity = quote.get();
            if (entity.isActive()) {
                entity.setActive(false);
                quoteRepository.save(entity);
                log.debug("Disabled quote quoteId={}", quoteId);
            }
            return CollaboratorResult.ok();
        } catch (Exception e) {
            return CollaboratorResult.failed(e);
        }
    }
}
