package com.payment.checkout.persistence.entity;

import com.payment.checkout.persistence.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored payment method a customer can be charged with again (card on file, subscriptions).
 */
@Entity
@Table(name = "vault_payment_tokens",
    uniqueConstraints = @UniqueConstraint(name = "uk_vault_customer_token", columnNames = {"customer_id", "gateway_token"}),
    indexes = @Index(name = "idx_vault_customer_id", columnList = "customer_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultPaymentTokenEntity {

    public static final String DETAIL_TYPE = "type";
    public static final String DETAIL_MASKED_CC = "maskedCC";
    public static final String DETAIL_EXPIRATION_DATE = "expirationDate";
    /** Recurring processing model the token was created for (CardOnFile, Subscription, UnscheduledCardOnFile). */
    public static final String DETAIL_TOKEN_TYPE = "tokenType";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "payment_method_code", nullable = false)
    private String paymentMethodCode;

    /** Gateway-side stored payment method id. */
    @Column(name = "gateway_token", nullable = false)
    private String gatewayToken;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "token_details", columnDefinition = "text")
    @Builder.Default
    private Map<String, Object> tokenDetails = new LinkedHashMap<>();

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
