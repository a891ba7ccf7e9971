package com.acme.orchestrator.sample;

import java.math.BigDecimal;

/** External payment processor used by the payment activities. */
public interface PaymentGateway {

  /**
   * Charges {@code amount} using the given payment method.
   *
   * @return the processor's transaction id
   */
  String charge(BigDecimal amount, PaymentMethod method);

  enum PaymentMethod {
    CARD,
    BANK,
    WALLET
  }
}
