package com.acme.orchestrator.sample;

import com.acme.orchestrator.activity.ActivityRegistry;
import com.acme.orchestrator.core.ClassifiedException;
import com.acme.orchestrator.core.Jsons;
import com.acme.orchestrator.core.PermanentException;
import com.acme.orchestrator.core.TransientException;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Charge and refund activities, registered with the activity registry at startup. Inputs and
 * outputs are snake_case JSON.
 */
@Singleton
public class PaymentActivities implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(PaymentActivities.class);

  public static final String CHARGE_PAYMENT = "charge_payment";
  public static final String REFUND_PAYMENT = "refund_payment";

  public record ChargePaymentInput(
      String orderId,
      BigDecimal amount,
      PaymentGateway.PaymentMethod paymentMethod,
      String customerId) {}

  public record ChargePaymentOutput(String paymentId, String transactionId, String status) {}

  public record RefundPaymentInput(String paymentId, BigDecimal amount) {}

  public record RefundPaymentOutput(String refundId, String status) {}

  private final ActivityRegistry registry;
  private final PaymentGateway gateway;

  public PaymentActivities(ActivityRegistry registry, PaymentGateway gateway) {
    this.registry = registry;
    this.gateway = gateway;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    register();
  }

  public void register() {
    registry.register(CHARGE_PAYMENT, (ctx, input) -> charge(input));
    registry.register(REFUND_PAYMENT, (ctx, input) -> refund(input));
    LOG.info("Registered payment activities: {}, {}", CHARGE_PAYMENT, REFUND_PAYMENT);
  }

  byte[] charge(byte[] input) {
    ChargePaymentInput request = parse(input, ChargePaymentInput.class, "payment");
    String transactionId;
    try {
      transactionId = gateway.charge(request.amount(), request.paymentMethod());
    } catch (ClassifiedException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new TransientException(
          "PAYMENT_PROCESSING_ERROR", "failed to process payment: " + e.getMessage(), e);
    }
    return toJson(
        new ChargePaymentOutput("PAY_" + request.orderId(), transactionId, "completed"),
        "payment");
  }

  byte[] refund(byte[] input) {
    RefundPaymentInput request = parse(input, RefundPaymentInput.class, "refund");
    if (request.paymentId() == null || request.paymentId().isEmpty()) {
      throw new PermanentException("MISSING_PAYMENT_ID", "payment ID is required");
    }
    return toJson(
        new RefundPaymentOutput("REFUND_" + request.paymentId(), "completed"), "refund");
  }

  private static <T> T parse(byte[] input, Class<T> type, String what) {
    try {
      return Jsons.fromJson(new String(input, StandardCharsets.UTF_8), type);
    } catch (RuntimeException e) {
      throw new PermanentException("INVALID_INPUT", "failed to unmarshal " + what + " input", e);
    }
  }

  private static byte[] toJson(Object output, String what) {
    try {
      return Jsons.toJson(output).getBytes(StandardCharsets.UTF_8);
    } catch (RuntimeException e) {
      throw new PermanentException(
          "SERIALIZATION_ERROR", "failed to marshal " + what + " output", e);
    }
  }
}
