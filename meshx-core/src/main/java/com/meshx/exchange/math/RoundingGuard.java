package com.meshx.exchange.math;

import java.math.BigInteger;

/**
 * Proportional-fill helpers shared by the settlement core and the settlement collaborators, so the
 * amount that gets checked is the amount that gets transferred.
 */
public final class RoundingGuard {

  private static final BigInteger PPM = BigInteger.valueOf(1_000_000L);
  private static final BigInteger MAX_ERROR_PPM = BigInteger.valueOf(1_000L);

  private RoundingGuard() {
  }

  /**
   * True when {@code target * numerator / denominator} truncates away more than 0.1% of its value.
   */
  public static boolean hasRoundingError(BigInteger numerator, BigInteger denominator, BigInteger target) {
    BigInteger remainder = Uint256Math.mulmod(target, numerator, denominator);
    if (remainder.signum() == 0) {
      return false;
    }
    // ratio of two valid words; intermediates may exceed 256 bits
    BigInteger errorPpm = remainder.multiply(PPM).divide(numerator.multiply(target));
    return errorPpm.compareTo(MAX_ERROR_PPM) > 0;
  }

  /**
   * {@code floor(target * numerator / denominator)} with checked intermediates.
   */
  public static BigInteger partialAmount(BigInteger numerator, BigInteger denominator, BigInteger target) {
    return Uint256Math.div(Uint256Math.mul(target, numerator), denominator);
  }
}
