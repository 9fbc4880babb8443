package com.meshx.exchange.tx;

import com.meshx.exchange.ledger.TransactionHash;
import com.meshx.exchange.order.OrderHash;

import java.math.BigInteger;

/**
 * @param orderHash null unless {@code callKind} is {@link CallKind#FILL_ORDER}
 */
public record ExecutionOutcome(
    TransactionHash transactionHash,
    CallKind callKind,
    OrderHash orderHash,
    BigInteger takerAssetFilledAmount
) {

  static ExecutionOutcome fill(TransactionHash transactionHash, OrderHash orderHash, BigInteger filled) {
    return new ExecutionOutcome(transactionHash, CallKind.FILL_ORDER, orderHash, filled);
  }

  static ExecutionOutcome unsupported(TransactionHash transactionHash) {
    return new ExecutionOutcome(transactionHash, CallKind.UNSUPPORTED, null, BigInteger.ZERO);
  }
}
