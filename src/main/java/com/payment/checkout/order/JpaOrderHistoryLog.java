package com.payment.checkout.order;

import com.payment.checkout.core.OrderHistoryLog;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.entity.OrderStatusHistoryEntity;
import com.payment.checkout.persistence.repository.OrderRepository;
import com.payment.checkout.persistence.repository.OrderStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes payment result comments to the order history table and the result indicator
 * to the order, in one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaOrderHistoryLog implements OrderHistoryLog {

    static final String ENTITY_NAME = "order";

    private final OrderStatusHistoryRepository historyRepository;
    private final OrderRepository orderRepository;

    @Override
    @Transactional
    public OrderEntity append(OrderEntity order, String comment, String authResult) {
        order.setAuthResultCode(authResult);
        OrderEntity saved = orderRepository.save(order);

        OrderStatusHistoryEntity entry = OrderStatusHistoryEntity.builder()
                .orderId(saved.getId())
                .status(saved.getStatus())
                .comment(comment)
                .entityName(ENTITY_NAME)
                .build();
        historyRepository.save(entry);
        log.debug("Appended history entry to order={}, status={}", saved.getIncrementId(), saved.getStatus());
        return saved;
    }
}
