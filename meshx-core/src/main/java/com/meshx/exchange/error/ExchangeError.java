package com.meshx.exchange.error;

/**
 * Hard-failure codes. Any of these aborts the whole invocation with no ledger change.
 */
public enum ExchangeError {
  INVALID_ORDER,
  INVALID_AMOUNT,
  INVALID_SIGNATURE,
  UNAUTHORIZED_SENDER,
  UNAUTHORIZED_TAKER,
  UNAUTHORIZED_MAKER,
  ARITHMETIC_OVERFLOW,
  ARITHMETIC_UNDERFLOW,
  DIVISION_BY_ZERO,
  MALFORMED_CALLDATA,
  EPOCH_NOT_INCREASING,
  SETTLEMENT_FAILED,
  TRANSACTION_REPLAYED
}
