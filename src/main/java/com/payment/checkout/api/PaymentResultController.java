package com.payment.checkout.api;

import com.payment.checkout.core.OrderPaymentStatusService;
import com.payment.checkout.core.PaymentResponseNormalizer;
import com.payment.checkout.core.PaymentResultProcessor;
import com.payment.checkout.domain.GatewayResponse;
import com.payment.checkout.domain.NormalizedResponse;
import com.payment.checkout.persistence.entity.OrderEntity;
import com.payment.checkout.persistence.repository.OrderRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Checkout endpoints used by the storefront after a payment call: submit the gateway's
 * result for an order, and poll the order's payment status.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
@Tag(name = "Payment results", description = "Apply gateway payment results to orders")
public class PaymentResultController {

    private final PaymentResultProcessor processor;
    private final PaymentResponseNormalizer normalizer;
    private final OrderPaymentStatusService paymentStatusService;
    private final OrderRepository orderRepository;

    @PostMapping("/{orderId}/payment-result")
    @Operation(
            summary = "Process payment result",
            description = "Apply a gateway /payments/details response to the order and return the storefront response. "
                    + "isFinal=false means the storefront must handle body.action and submit the details again. "
                    + "Unknown result codes are reported as Error.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Result applied. Check body.isFinal and body.resultCode.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = NormalizedResponse.class))),
            @ApiResponse(responseCode = "400", description = "Malformed body. Body: { \"error\": \"BAD_REQUEST\", \"message\": ... }"),
            @ApiResponse(responseCode = "404", description = "Unknown order. Body: { \"error\": \"ORDER_NOT_FOUND\", \"message\": ... }")
    })
    public ResponseEntity<NormalizedResponse> processResult(@PathVariable Long orderId,
                                                            @RequestBody GatewayResponse response) {
        OrderEntity order = findOrder(orderId);
        boolean accepted = processor.process(response, order);
        log.info("Payment result processed: order={}, resultCode={}, accepted={}",
                order.getIncrementId(), response.getResultCode(), accepted);

        return ResponseEntity.ok(normalizer.normalize(
                response.getResultCode(), response.getAction(), response.getAdditionalData()));
    }

    @GetMapping("/{orderId}/payment-status")
    @Operation(
            summary = "Get payment status",
            description = "Storefront response rebuilt from the last payment result stored on the order. "
                    + "Returns resultCode Error when no result was processed yet.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current payment status",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = NormalizedResponse.class))),
            @ApiResponse(responseCode = "404", description = "Unknown order")
    })
    public ResponseEntity<NormalizedResponse> paymentStatus(@PathVariable Long orderId) {
        return ResponseEntity.ok(paymentStatusService.getPaymentStatus(findOrder(orderId)));
    }

    private OrderEntity findOrder(Long orderId) {
        return orderRepository.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
