package com.meshx.exchange.ledger;

import com.meshx.exchange.math.Uint256Math;

import java.math.BigInteger;

public record FillLedgerEntry(BigInteger filledAmount, BigInteger cancelledAmount) {

  public static final FillLedgerEntry EMPTY = new FillLedgerEntry(BigInteger.ZERO, BigInteger.ZERO);

  public BigInteger unavailableAmount() {
    return Uint256Math.add(filledAmount, cancelledAmount);
  }

  /**
   * No fill or cancel has ever been recorded against this hash.
   */
  public boolean isUnreferenced() {
    return filledAmount.signum() == 0 && cancelledAmount.signum() == 0;
  }
}
