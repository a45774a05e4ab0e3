package com.payment.checkout.persistence.entity;

import com.payment.checkout.domain.OrderStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Sales order as seen by the payment flow. Owned by the order-management side;
 * the payment flow only moves its status and fills its payment record.
 */
@Entity
@Table(name = "sales_orders", indexes = {
    @Index(name = "idx_order_increment_id", columnList = "increment_id", unique = true),
    @Index(name = "idx_order_quote_id", columnList = "quote_id"),
    @Index(name = "idx_order_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Customer-facing order number. */
    @Column(name = "increment_id", nullable = false)
    private String incrementId;

    @Column(name = "quote_id")
    private Long quoteId;

    /** Null for guest checkouts. */
    @Column(name = "customer_id")
    private String customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private OrderStatus status;

    /** Last result indicator processed for this order; lets re-submissions be detected. */
    @Column(name = "auth_result_code")
    private String authResultCode;

    @Embedded
    @Builder.Default
    private OrderPayment payment = new OrderPayment();

    /** Serializes status transitions per order. */
    @Version
    @Column(name = "version")
    private Long version;

    /** Set when the payment flow asked for cancellation in this unit of work. */
    @Transient
    private boolean cancelRequested;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /** Hibernate maps an all-null embeddable to null; the payment flow always needs one. */
    public OrderPayment getPayment() {
        if (payment == null) {
            payment = new OrderPayment();
        }
        return payment;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
