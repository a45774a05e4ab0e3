package com.payment.checkout.order;

import com.payment.checkout.config.CheckoutProperties;
import com.payment.checkout.core.OrderLifecycle;
import com.payment.checkout.domain.OrderStatus;
import com.payment.checkout.domain.PaymentCancelledAction;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Status transitions for orders driven by payment results. Concurrent writers on the same
 * order are rejected by the entity's optimistic lock, so one transition wins per version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefaultOrderLifecycle implements OrderLifecycle {

    private final OrderRepository orderRepository;
    private final CheckoutProperties properties;

    @Override
    public OrderEntity advanceToNew(OrderEntity order) {
        if (order.getStatus() == OrderStatus.PENDING_PAYMENT) {
            order.setStatus(OrderStatus.NEW);
            log.info("Order={} moved from PENDING_PAYMENT to NEW", order.getIncrementId());
        } else {
            log.debug("Order={} is {}, not advancing to NEW", order.getIncrementId(), order.getStatus());
        }
        return order;
    }

    @Override
    public boolean isCancellable(OrderEntity order) {
        return order.getStatus() != null && order.getStatus().canCancel();
    }

    @Override
    @Transactional
    public OrderEntity cancel(OrderEntity order) {
        PaymentCancelledAction action = properties.getOrder().getPaymentCancelledAction();
        if (action == PaymentCancelledAction.HOLD) {
            if (order.getStatus() != null && order.getStatus().canHold()) {
                order.setStatus(OrderStatus.HOLDED);
                log.info("Order={} put on hold after cancelled payment", order.getIncrementId());
                return orderRepository.save(order);
            }
            log.info("Order={} cannot be put on hold, status={}", order.getIncrementId(), order.getStatus());
            return order;
        }

        if (!isCancellable(order)) {
            log.info("Order={} cannot be cancelled, status={}", order.getIncrementId(), order.getStatus());
            return order;
        }
        order.setStatus(OrderStatus.CANCELED);
        log.info("Order={} cancelled after refused payment", order.getIncrementId());
        return orderRepository.save(order);
    }
}
