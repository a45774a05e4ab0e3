package com.payment.checkout.statedata;

import com.payment.checkout.config.CheckoutProperties;
import com.payment.checkout.core.CollaboratorResult;
import com.payment.checkout.core.TransientStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps the storefront's payment state data per quote in Redis until the payment
 * reaches a result that no longer needs it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisStateDataStore implements TransientStateStore {

    static final String KEY_PREFIX = "checkout:state-data:";

    private final RedisTemplate<String, Map<String, Object>> redisTemplate;
    private final CheckoutProperties properties;

    @Override
    public void save(Long quoteId, Map<String, Object> stateData) {
        if (quoteId == null) {
            throw new IllegalArgumentException("quoteId is required");
        }
        redisTemplate.opsForValue().set(key(quoteId), stateData, properties.getStateData().getTtl());
        log.debug("Stored state data for quoteId={}", quoteId);
    }

    @Override
    public Map<String, Object> getStateData(Long quoteId) {
        if (quoteId == null) {
            return new HashMap<>();
        }
        try {
            Map<String, Object> stored = redisTemplate.opsForValue().get(key(quoteId));
            return stored != null ? new HashMap<>(stored) : new HashMap<>();
        } catch (Exception e) {
            log.warn("State data read failed for quoteId={} (Redis unavailable?): {}", quoteId, e.getMessage());
            return new HashMap<>();
        }
    }

    @Override
    public CollaboratorResult clear(Long quoteId, String authResult) {
        if (quoteId == null || !properties.getStateData().getCleanupResultCodes().contains(authResult)) {
            return CollaboratorResult.ok();
        }
        try {
            Boolean deleted = redisTemplate.delete(key(quoteId));
            log.debug("Cleared state data for quoteId={}, authResult={}, deleted={}", quoteId, authResult, deleted);
            return CollaboratorResult.ok();
        } catch (Exception e) {
            return CollaboratorResult.failed(e);
        }
    }

    private static String key(Long quoteId) {
        return KEY_PREFIX + quoteId;
    }
}
