package com.meshx.exchange.math;

import com.meshx.exchange.error.ExchangeError;
import com.meshx.exchange.error.ExchangeException;

import java.math.BigInteger;

/**
 * Checked unsigned 256-bit arithmetic. Every result is kept inside {@code [0, 2^256 - 1]};
 * anything outside aborts with an {@link ExchangeException} instead of wrapping.
 */
public final class Uint256Math {

  public static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

  private Uint256Math() {
  }

  public static boolean isUint256(BigInteger value) {
    return value != null && value.signum() >= 0 && value.bitLength() <= 256;
  }

  public static BigInteger add(BigInteger a, BigInteger b) {
    BigInteger sum = operand(a).add(operand(b));
    if (sum.bitLength() > 256) {
      throw new ExchangeException(ExchangeError.ARITHMETIC_OVERFLOW, a + " + " + b);
    }
    return sum;
  }

  public static BigInteger sub(BigInteger a, BigInteger b) {
    BigInteger diff = operand(a).subtract(operand(b));
    if (diff.signum() < 0) {
      throw new ExchangeException(ExchangeError.ARITHMETIC_UNDERFLOW, a + " - " + b);
    }
    return diff;
  }

  public static BigInteger mul(BigInteger a, BigInteger b) {
    BigInteger product = operand(a).multiply(operand(b));
    if (product.bitLength() > 256) {
      throw new ExchangeException(ExchangeError.ARITHMETIC_OVERFLOW, a + " * " + b);
    }
    return product;
  }

  public static BigInteger div(BigInteger a, BigInteger b) {
    if (operand(b).signum() == 0) {
      throw new ExchangeException(ExchangeError.DIVISION_BY_ZERO, a + " / 0");
    }
    return operand(a).divide(b);
  }

  /**
   * {@code (a * b) mod m} over the full-width product, like the EVM's mulmod opcode.
   */
  public static BigInteger mulmod(BigInteger a, BigInteger b, BigInteger m) {
    if (operand(m).signum() == 0) {
      throw new ExchangeException(ExchangeError.DIVISION_BY_ZERO, "mulmod by 0");
    }
    return operand(a).multiply(operand(b)).mod(m);
  }

  private static BigInteger operand(BigInteger value) {
    if (!isUint256(value)) {
      throw new ExchangeException(ExchangeError.ARITHMETIC_OVERFLOW, "not a uint256 operand: " + value);
    }
    return value;
  }
}
