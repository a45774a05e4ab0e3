package com.payment.checkout.config;

import com.payment.checkout.domain.PaymentCancelledAction;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code checkout.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "checkout")
public class CheckoutProperties {

    private Order order = new Order();
    private Vault vault = new Vault();
    private StateData stateData = new StateData();

    @Data
    public static class Order {
        /** Applied to orders whose payment was refused or cancelled. */
        @NotNull
        private PaymentCancelledAction paymentCancelledAction = PaymentCancelledAction.CANCEL;
    }

    @Data
    public static class Vault {
        private boolean enabled = true;
        /** Used when neither the token nor the provider defines a model. */
        private String defaultRecurringProcessingModel = "CardOnFile";
        /** Provider code (e.g. "klarna", "sepadirectdebit") to recurring processing model. */
        private Map<String, String> recurringProcessingModels = new HashMap<>();

        public String recurringProcessingModelFor(String providerCode) {
            if (providerCode != null && recurringProcessingModels.containsKey(providerCode)) {
                return recurringProcessingModels.get(providerCode);
            }
            return defaultRecurringProcessingModel;
        }
    }

    @Data
    public static class StateData {
        private Duration ttl = Duration.ofHours(24);
        /** Result indicators after which the quote's state data is dropped. */
        private List<String> cleanupResultCodes = new ArrayList<>(List.of("Authorised"));
    }
}
