package com.meshx.exchange.events;

import com.meshx.exchange.order.OrderHash;

import java.math.BigInteger;

/**
 * @param requestedAmount taker-asset amount the caller asked to fill or cancel
 * @param remainingAmount taker-asset amount still open on the order when the call was evaluated
 */
public record OrderRejectedEvent(
    RejectReason reason,
    OrderHash orderHash,
    BigInteger requestedAmount,
    BigInteger remainingAmount
) implements ExchangeEvent {

  @Override
  public String type() {
    return reason.eventType();
  }
}
