package com.meshx.exchange.order;

import lombok.NonNull;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Conversions between whole token units and base units (the smallest denomination).
 * With 18 decimals, 1 unit is 10^18 base units.
 */
public final class TokenUnits {

  private TokenUnits() {
  }

  public static BigDecimal toUnitAmount(@NonNull BigInteger baseUnitAmount, int decimals) {
    requireDecimals(decimals);
    return new BigDecimal(baseUnitAmount).movePointLeft(decimals);
  }

  /**
   * Fails with {@link ArithmeticException} when the amount has more fractional digits than the token.
   */
  public static BigInteger toBaseUnitAmount(@NonNull BigDecimal unitAmount, int decimals) {
    requireDecimals(decimals);
    return unitAmount.movePointRight(decimals).toBigIntegerExact();
  }

  private static void requireDecimals(int decimals) {
    if (decimals < 0) {
      throw new IllegalArgumentException("decimals must be >= 0, got " + decimals);
    }
  }
}
