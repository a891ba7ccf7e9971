package com.acme.orchestrator.sample;

import com.acme.orchestrator.core.TransientException;
import jakarta.inject.Singleton;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * In-memory payment processor for local runs. A configurable share of charges fails with a
 * transient gateway error so the retry path gets exercised.
 */
@Singleton
public class SimulatedPaymentGateway implements PaymentGateway {

  public static final String PAYMENT_GATEWAY_UNAVAILABLE = "PAYMENT_GATEWAY_UNAVAILABLE";
  static final double DEFAULT_FAILURE_RATE = 0.1;

  private final double failureRate;
  private final DoubleSupplier random;
  private final AtomicInteger sequence = new AtomicInteger();
  private final Map<String, BigDecimal> transactions = new ConcurrentHashMap<>();

  public SimulatedPaymentGateway() {
    this(DEFAULT_FAILURE_RATE, () -> ThreadLocalRandom.current().nextDouble());
  }

  public SimulatedPaymentGateway(double failureRate, DoubleSupplier random) {
    this.failureRate = failureRate;
    this.random = random;
  }

  @Override
  public String charge(BigDecimal amount, PaymentMethod method) {
    if (random.getAsDouble() < failureRate) {
      throw new TransientException(
          PAYMENT_GATEWAY_UNAVAILABLE, "payment gateway temporarily unavailable");
    }
    if (amount == null || amount.signum() <= 0) {
      throw new IllegalArgumentException("invalid amount: " + amount);
    }
    String transactionId = "TXN_" + sequence.incrementAndGet();
    transactions.put(transactionId, amount);
    return transactionId;
  }

  public Optional<BigDecimal> getTransaction(String transactionId) {
    return Optional.ofNullable(transactions.get(transactionId));
  }
}
