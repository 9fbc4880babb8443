package com.meshx.exchange.tx;

public enum CallKind {
  FILL_ORDER,
  /** Accepted and marked executed, but nothing else happens. */
  UNSUPPORTED
}
