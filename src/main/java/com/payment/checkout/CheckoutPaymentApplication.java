package com.payment.checkout;

import com.payment.checkout.config.CheckoutProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the checkout payment result handler. Provides:
 * <ul>
 *   <li>Gateway result code to order lifecycle mapping (advance, cancel, await webhook)</li>
 *   <li>Storefront response normalization and payment status polling</li>
 *   <li>Recurring token storage and vault charge request building</li>
 *   <li>Kafka events for every processed result; OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(CheckoutProperties.class)
public class CheckoutPaymentApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutPaymentApplication.class, args);
    }
}
